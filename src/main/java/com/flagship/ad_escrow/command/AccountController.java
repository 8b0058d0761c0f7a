package com.flagship.ad_escrow.command;

import com.flagship.ad_escrow.command.dto.BalanceResponse;
import com.flagship.ad_escrow.command.dto.RegisterUserRequest;
import com.flagship.ad_escrow.command.dto.SessionRequest;
import com.flagship.ad_escrow.command.dto.SessionResponse;
import com.flagship.ad_escrow.command.dto.TopUpRequest;
import com.flagship.ad_escrow.command.dto.TransactionResponse;
import com.flagship.ad_escrow.command.dto.UserResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Users, balances, top-ups and dialogue sessions. The acting user is taken from {@code X-User-Id}.
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final CampaignCommandService commands;

    @PostMapping
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        var user = commands.registerUser(request.getExternalId(), request.getUsername(), request.getRole());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @DeleteMapping("/me")
    public UserResponse deactivate(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return UserResponse.from(commands.deactivateUser(userId));
    }

    @PostMapping("/me/top-ups")
    public ResponseEntity<TransactionResponse> topUp(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                                     @RequestHeader(ApiHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
                                                     @Valid @RequestBody TopUpRequest request) {
        log.info("Top-up requested: amount={}, idempotencyKey={}", request.getAmount(), idempotencyKey);
        var transaction = commands.topUp(userId, request.getAmount(), idempotencyKey);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @GetMapping("/me/balance")
    public BalanceResponse balance(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return new BalanceResponse(userId, commands.getBalance(userId));
    }

    @GetMapping("/me/transactions")
    public List<TransactionResponse> transactions(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return commands.listTransactions(userId).stream().map(TransactionResponse::from).toList();
    }

    @GetMapping("/me/session")
    public SessionResponse session(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        return SessionResponse.from(commands.getSession(userId));
    }

    @PutMapping("/me/session")
    public SessionResponse advanceSession(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                          @Valid @RequestBody SessionRequest request) {
        return SessionResponse.from(commands.advanceSession(userId, request.getStep(), request.getAttributes()));
    }

    @DeleteMapping("/me/session")
    public ResponseEntity<Void> clearSession(@RequestHeader(ApiHeaders.USER_ID) UUID userId) {
        commands.clearSession(userId);
        return ResponseEntity.noContent().build();
    }
}
