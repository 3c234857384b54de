package com.flagship.order_payments.payment;

import com.flagship.order_payments.payment.exception.RequestValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes mobile money numbers to digits only, prefixed with the country code.
 *
 * Accepted input: "+255 712 345 678", "255-712-345-678", "(255) 712.345.678" and the local
 * form "0712345678", which gets the default country code.
 */
@Component
public class PhoneNumberNormalizer {

    static final String FIELD = "phone_number";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-().]");
    private static final Pattern INTERNATIONAL = Pattern.compile("[1-9]\\d{9,14}");
    private static final Pattern LOCAL = Pattern.compile("0\\d{9}");

    private final String defaultCountryCode;

    public PhoneNumberNormalizer(@Value("${order-payments.phone.default-country-code:255}") String defaultCountryCode) {
        this.defaultCountryCode = defaultCountryCode;
    }

    /**
     * @throws RequestValidationException on the phone_number field when the input can't be normalized
     */
    public String normalize(String rawPhoneNumber) {
        if (rawPhoneNumber == null || rawPhoneNumber.isBlank()) {
            throw RequestValidationException.of(FIELD, "Phone number is required");
        }

        String candidate = SEPARATORS.matcher(rawPhoneNumber.trim()).replaceAll("");
        if (candidate.startsWith("+")) {
            candidate = candidate.substring(1);
        } else if (LOCAL.matcher(candidate).matches()) {
            candidate = defaultCountryCode + candidate.substring(1);
        }

        if (!INTERNATIONAL.matcher(candidate).matches()) {
            throw RequestValidationException.of(FIELD,
                "Phone number must be 10 to 15 digits including the country code");
        }
        return candidate;
    }
}
