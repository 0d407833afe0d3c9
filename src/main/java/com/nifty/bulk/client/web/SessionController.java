package com.nifty.bulk.client.web;

import com.nifty.bulk.client.common.exception.Http;
import com.nifty.bulk.client.dto.LoginRequest;
import com.nifty.bulk.client.model.AuthCredentials;
import com.nifty.bulk.client.service.ClientSessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/session")
@RequiredArgsConstructor
public class SessionController {

    private final ClientSessionService client;

    @GetMapping
    public ResponseEntity<?> state() {
        return Http.from(client.sessionState());
    }

    @PostMapping("/login/mobile")
    public ResponseEntity<?> loginMobile(@Valid @RequestBody LoginRequest req) {
        return Http.from(client.login(AuthCredentials.mobileOtp(req.identifier(), req.secret())));
    }

    @PostMapping("/login/email")
    public ResponseEntity<?> loginEmail(@Valid @RequestBody LoginRequest req) {
        return Http.from(client.login(AuthCredentials.email(req.identifier(), req.secret())));
    }

    @PostMapping("/login/superadmin")
    public ResponseEntity<?> loginSuperOperator(@Valid @RequestBody LoginRequest req) {
        return Http.from(client.login(AuthCredentials.superOperator(req.identifier(), req.secret())));
    }

    @PostMapping("/resume")
    public ResponseEntity<?> resume() {
        return Http.from(client.resume());
    }

    @PostMapping("/logout")
    public ResponseEntity<?> logout() {
        return Http.from(client.logout());
    }

    @PostMapping("/logout-all")
    public ResponseEntity<?> logoutAll() {
        return Http.from(client.logoutAllDevices());
    }
}
