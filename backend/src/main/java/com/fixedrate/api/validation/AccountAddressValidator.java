package com.fixedrate.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.stereotype.Component;

/**
 * Bean Validation hook for {@link AccountAddress}. Delegates to AddressValidator.
 */
@Component
public class AccountAddressValidator implements ConstraintValidator<AccountAddress, String> {

    private final AddressValidator addressValidator;

    public AccountAddressValidator(AddressValidator addressValidator) {
        this.addressValidator = addressValidator;
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value != null && addressValidator.isValidAddress(value);
    }
}
