package com.fixedrate.venue.simulation;

import com.fixedrate.common.FixedPointMath;
import com.fixedrate.domain.AccountId;
import com.fixedrate.venue.AssetToken;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-process fungible token: balances and allowances in memory. Transfers without enough balance or allowance
 * return false rather than throw, the way a non-reverting token does.
 */
@Slf4j
public class SimulatedToken {

    private final AccountId id;
    private final Map<AccountId, BigInteger> balances = new HashMap<>();
    private final Map<AccountId, Map<AccountId, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public SimulatedToken(AccountId id) {
        this.id = id;
    }

    public AccountId getId() {
        return id;
    }

    public synchronized BigInteger balanceOf(AccountId account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    public synchronized BigInteger allowance(AccountId owner, AccountId spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    public synchronized void mint(AccountId to, BigInteger amount) {
        totalSupply = FixedPointMath.add(totalSupply, amount);
        balances.merge(to, amount, BigInteger::add);
        log.debug("Minted {} to {}", amount, to);
    }

    public synchronized boolean burn(AccountId from, BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
        return true;
    }

    public synchronized boolean transfer(AccountId from, AccountId to, BigInteger amount) {
        if (amount.signum() < 0) {
            return false;
        }
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) {
            return false;
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }

    public synchronized boolean approve(AccountId owner, AccountId spender, BigInteger amount) {
        if (amount.signum() < 0) {
            return false;
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
        return true;
    }

    public synchronized boolean transferFrom(AccountId spender, AccountId from, AccountId to, BigInteger amount) {
        BigInteger allowed = allowance(from, spender);
        if (allowed.compareTo(amount) < 0) {
            return false;
        }
        if (!transfer(from, to, amount)) {
            return false;
        }
        if (allowed.compareTo(FixedPointMath.MAX_UINT256) != 0) {
            allowances.get(from).put(spender, allowed.subtract(amount));
        }
        return true;
    }

    /**
     * Handle acting as {@code caller}.
     */
    public AssetToken connect(AccountId caller) {
        return new AssetToken() {
            @Override
            public AccountId id() {
                return id;
            }

            @Override
            public boolean transferFrom(AccountId from, AccountId to, BigInteger amount) {
                return SimulatedToken.this.transferFrom(caller, from, to, amount);
            }

            @Override
            public boolean transfer(AccountId to, BigInteger amount) {
                return SimulatedToken.this.transfer(caller, to, amount);
            }

            @Override
            public boolean approve(AccountId spender, BigInteger amount) {
                return SimulatedToken.this.approve(caller, spender, amount);
            }

            @Override
            public BigInteger balanceOf(AccountId account) {
                return SimulatedToken.this.balanceOf(account);
            }
        };
    }
}
