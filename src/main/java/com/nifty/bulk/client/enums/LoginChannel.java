package com.nifty.bulk.client.enums;

public enum LoginChannel {
    MOBILE_OTP,
    EMAIL_PASSWORD,
    SUPER_OPERATOR
}
