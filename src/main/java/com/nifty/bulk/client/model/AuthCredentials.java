package com.nifty.bulk.client.model;

import com.nifty.bulk.client.enums.LoginChannel;
import lombok.ToString;
import lombok.Value;

@Value
public class AuthCredentials {

    LoginChannel channel;
    String identifier;   // mobile number or e-mail
    @ToString.Exclude
    String secret;       // OTP or password

    public static AuthCredentials mobileOtp(String mobile, String otp) {
        return new AuthCredentials(LoginChannel.MOBILE_OTP, mobile, otp);
    }

    public static AuthCredentials email(String email, String password) {
        return new AuthCredentials(LoginChannel.EMAIL_PASSWORD, email, password);
    }

    public static AuthCredentials superOperator(String email, String password) {
        return new AuthCredentials(LoginChannel.SUPER_OPERATOR, email, password);
    }
}
