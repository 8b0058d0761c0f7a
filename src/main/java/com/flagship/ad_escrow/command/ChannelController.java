package com.flagship.ad_escrow.command;

import com.flagship.ad_escrow.command.dto.ChannelResponse;
import com.flagship.ad_escrow.command.dto.RegisterChannelRequest;
import com.flagship.ad_escrow.command.dto.VerificationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/channels")
@RequiredArgsConstructor
public class ChannelController {

    private final CampaignCommandService commands;

    @PostMapping
    public ResponseEntity<ChannelResponse> register(@RequestHeader(ApiHeaders.USER_ID) UUID ownerId,
                                                    @Valid @RequestBody RegisterChannelRequest request) {
        var channel = commands.registerChannel(ownerId, request.getExternalId(), request.getTitle());
        return ResponseEntity.status(HttpStatus.CREATED).body(ChannelResponse.from(channel));
    }

    @PostMapping("/{id}/verification")
    public VerificationResponse verify(@RequestHeader(ApiHeaders.USER_ID) UUID ownerId,
                                       @PathVariable("id") UUID channelId) {
        return VerificationResponse.from(commands.verifyChannel(ownerId, channelId));
    }

    @GetMapping
    public List<ChannelResponse> list(@RequestHeader(ApiHeaders.USER_ID) UUID ownerId) {
        return commands.listChannels(ownerId).stream().map(ChannelResponse::from).toList();
    }
}
