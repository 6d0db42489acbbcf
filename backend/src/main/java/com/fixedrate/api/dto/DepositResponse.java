package com.fixedrate.api.dto;

import java.math.BigInteger;

public record DepositResponse(BigInteger amount, BigInteger shares) {
}
