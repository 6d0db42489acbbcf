package com.fixedrate.api.dto;

import java.math.BigInteger;

/**
 * Withdraw and claim-profit result. received can be below requested when the venue short-pays.
 */
public record PayoutResponse(BigInteger requested, BigInteger received) {
}
