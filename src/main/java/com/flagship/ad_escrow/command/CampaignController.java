package com.flagship.ad_escrow.command;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.command.dto.AcceptOfferRequest;
import com.flagship.ad_escrow.command.dto.CampaignResponse;
import com.flagship.ad_escrow.command.dto.CreateCampaignRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
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

/**
 * Campaign lifecycle commands.
 *
 * Creation requires an {@code Idempotency-Key}; repeating it returns the campaign
 * created the first time with 200 instead of 201.
 */
@RestController
@RequestMapping("/api/campaigns")
@RequiredArgsConstructor
@Slf4j
public class CampaignController {

    private final CampaignCommandService commands;

    @PostMapping
    public ResponseEntity<CampaignResponse> create(@RequestHeader(ApiHeaders.USER_ID) UUID advertiserId,
                                                   @RequestHeader(ApiHeaders.IDEMPOTENCY_KEY) String idempotencyKey,
                                                   @Valid @RequestBody CreateCampaignRequest request) {
        log.info("Received campaign creation request: idempotencyKey={}, budget={}", idempotencyKey, request.getBudget());
        var creation = commands.createCampaign(advertiserId, request.getAdContent(), request.getBudget(),
                request.targetDuration(), idempotencyKey);

        return ResponseEntity.status(creation.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(withHold(creation.getCampaign()));
    }

    @PostMapping("/{id}/funding")
    public CampaignResponse fund(@RequestHeader(ApiHeaders.USER_ID) UUID advertiserId,
                                 @PathVariable("id") UUID campaignId) {
        return withHold(commands.fundCampaign(advertiserId, campaignId));
    }

    @PostMapping("/{id}/cancellation")
    public CampaignResponse cancel(@RequestHeader(ApiHeaders.USER_ID) UUID advertiserId,
                                   @PathVariable("id") UUID campaignId) {
        return withHold(commands.cancelCampaign(advertiserId, campaignId));
    }

    @PostMapping("/{id}/acceptance")
    public CampaignResponse accept(@RequestHeader(ApiHeaders.USER_ID) UUID ownerId,
                                   @PathVariable("id") UUID campaignId,
                                   @Valid @RequestBody AcceptOfferRequest request) {
        return withHold(commands.acceptOffer(ownerId, campaignId, request.getChannelId()));
    }

    @GetMapping("/offers")
    public List<CampaignResponse> offers(@RequestHeader(ApiHeaders.USER_ID) UUID ownerId) {
        return commands.listOffers(ownerId).stream().map(CampaignResponse::from).toList();
    }

    @GetMapping
    public List<CampaignResponse> list(@RequestHeader(ApiHeaders.USER_ID) UUID advertiserId) {
        return commands.listCampaigns(advertiserId).stream().map(CampaignResponse::from).toList();
    }

    @GetMapping("/{id}")
    public CampaignResponse get(@RequestHeader(ApiHeaders.USER_ID) UUID userId,
                                @PathVariable("id") UUID campaignId) {
        return withHold(commands.getCampaign(userId, campaignId));
    }

    private CampaignResponse withHold(Campaign campaign) {
        return CampaignResponse.from(campaign, commands.getHold(campaign.getId()).orElse(null));
    }
}
