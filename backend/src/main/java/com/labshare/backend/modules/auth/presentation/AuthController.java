package com.labshare.backend.modules.auth.presentation;

import java.util.Optional;

import com.labshare.backend.global.security.AuthCookies;
import com.labshare.backend.global.security.SecurityUtils;
import com.labshare.backend.global.security.StudentPrincipal;
import com.labshare.backend.modules.auth.application.AuthService;
import com.labshare.backend.modules.auth.application.LoginResult;
import com.labshare.backend.modules.auth.presentation.dto.AuthStatusResponse;
import com.labshare.backend.modules.auth.presentation.dto.AuthStatusResponse.StudentSummary;
import com.labshare.backend.modules.auth.presentation.dto.LogoutResponse;
import com.labshare.backend.modules.auth.presentation.dto.OtpRequest;
import com.labshare.backend.modules.auth.presentation.dto.OtpRequestResponse;
import com.labshare.backend.modules.auth.presentation.dto.OtpVerifyRequest;
import com.labshare.backend.modules.auth.presentation.dto.OtpVerifyResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;
    private final AuthCookies authCookies;

    public AuthController(AuthService authService, AuthCookies authCookies) {
        this.authService = authService;
        this.authCookies = authCookies;
    }

    @Operation(summary = "로그인 코드 요청", description = "등록된 이메일로 6자리 일회용 코드를 보낸다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "발송 성공"),
            @ApiResponse(responseCode = "404", description = "등록되지 않은 이메일"),
            @ApiResponse(responseCode = "429", description = "요청 한도 초과"),
            @ApiResponse(responseCode = "502", description = "메일 발송 실패")
    })
    @PostMapping("/auth/request-otp")
    public ResponseEntity<OtpRequestResponse> requestOtp(@Valid @RequestBody OtpRequest request) {
        long expiresIn = authService.requestCode(request.email());
        return ResponseEntity.ok(new OtpRequestResponse(true, expiresIn));
    }

    @Operation(summary = "로그인 코드 확인", description = "코드를 확인하고 세션 쿠키를 발급한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "로그인 성공"),
            @ApiResponse(responseCode = "400", description = "잘못되었거나 만료된 코드"),
            @ApiResponse(responseCode = "404", description = "등록되지 않은 이메일")
    })
    @PostMapping("/auth/verify-otp")
    public ResponseEntity<OtpVerifyResponse> verifyOtp(
            @Valid @RequestBody OtpVerifyRequest request,
            @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
            HttpServletResponse response
    ) {
        LoginResult result = authService.verifyCode(request.email(), request.code(), userAgent);
        authCookies.write(response, result.token(), result.fingerprint());
        return ResponseEntity.ok(new OtpVerifyResponse(true, result.studentId(), result.email()));
    }

    @Operation(summary = "로그아웃", description = "현재 세션을 폐기하고 인증 쿠키를 지운다. 항상 성공한다.")
    @PostMapping("/auth/logout")
    public ResponseEntity<LogoutResponse> logout(HttpServletRequest request, HttpServletResponse response) {
        AuthCookies.read(request, AuthCookies.ACCESS_TOKEN).ifPresent(authService::logout);
        authCookies.clear(request, response);
        return ResponseEntity.ok(LogoutResponse.single());
    }

    @Operation(summary = "전체 로그아웃", description = "모든 기기의 세션을 폐기한다.")
    @PostMapping("/auth/logout-all")
    public ResponseEntity<LogoutResponse> logoutEverywhere(HttpServletRequest request, HttpServletResponse response) {
        int revoked = authService.logoutEverywhere(SecurityUtils.getCurrentStudentId());
        authCookies.clear(request, response);
        return ResponseEntity.ok(new LogoutResponse(true, revoked));
    }

    @GetMapping("/auth/status")
    public ResponseEntity<AuthStatusResponse> status() {
        Optional<StudentPrincipal> principal = SecurityUtils.findCurrentPrincipal();
        if (principal.isEmpty()) {
            return ResponseEntity.ok(AuthStatusResponse.anonymous());
        }
        return ResponseEntity.ok(authService.findAuthenticatedStudent(principal.get().studentId())
                .map(student -> new AuthStatusResponse(true,
                        new StudentSummary(student.getId(), student.getName(), student.getEmail())))
                .orElseGet(AuthStatusResponse::anonymous));
    }
}
