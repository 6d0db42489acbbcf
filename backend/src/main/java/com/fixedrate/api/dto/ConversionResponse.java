package com.fixedrate.api.dto;

import java.math.BigInteger;

public record ConversionResponse(BigInteger input, BigInteger result) {
}
