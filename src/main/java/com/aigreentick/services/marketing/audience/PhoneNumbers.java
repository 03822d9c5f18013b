package com.aigreentick.services.marketing.audience;

import java.util.regex.Pattern;

/**
 * Accepted recipient phone format: 8 to 15 digits with an optional leading '+'.
 * Numbers are compared as written, so "+91..." and "91..." are distinct recipients.
 */
public final class PhoneNumbers {

    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9]{8,15}$");

    private PhoneNumbers() {
    }

    public static boolean isValid(String phone) {
        return phone != null && PHONE.matcher(phone).matches();
    }
}
