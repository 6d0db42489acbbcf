package com.fixedrate.api.validation;

import com.fixedrate.domain.AccountId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns the X-Caller header into the caller identity the engine authorizes against.
 */
@Component
@RequiredArgsConstructor
public class CallerResolver {

    public static final String CALLER_HEADER = "X-Caller";

    private final AddressValidator addressValidator;

    /**
     * @throws InvalidAddressException when the header is missing or not an address
     */
    public AccountId resolve(String header) {
        if (!addressValidator.isValidAddress(header)) {
            throw new InvalidAddressException(CALLER_HEADER + " must be a 0x-prefixed 20-byte address");
        }
        return AccountId.of(header);
    }

    public AccountId resolveAccount(String address) {
        if (!addressValidator.isValidAddress(address)) {
            throw new InvalidAddressException("Invalid account address: " + address);
        }
        return AccountId.of(address);
    }
}
