package com.flagship.ad_escrow.support;

import com.flagship.ad_escrow.campaign.Campaign;
import com.flagship.ad_escrow.channel.Channel;
import com.flagship.ad_escrow.channel.ChannelService;
import com.flagship.ad_escrow.channel.ChannelVerifier;
import com.flagship.ad_escrow.command.CampaignCommandService;
import com.flagship.ad_escrow.ledger.LedgerService;
import com.flagship.ad_escrow.ledger.TransactionKind;
import com.flagship.ad_escrow.simulator.SimulatedTelegramGateway;
import com.flagship.ad_escrow.user.User;
import com.flagship.ad_escrow.user.UserRole;
import com.flagship.ad_escrow.user.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Spring context against a real PostgreSQL, with every background job switched off
 * so tests drive time and transitions themselves. Skipped without Docker.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@Import(IntegrationTestBase.TestClockConfig.class)
public abstract class IntegrationTestBase {

    public static final Instant START = Instant.parse("2026-01-05T10:00:00Z");

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("ad_escrow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.data.redis.port", () -> "1");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("campaign.maintenance.enabled", () -> "false");
        registry.add("verification.recheck.enabled", () -> "false");
        registry.add("posting.auto-start", () -> "false");
        registry.add("posting.initial-backoff", () -> "PT0.05S");
        registry.add("posting.max-backoff", () -> "PT0.2S");
    }

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected UserService userService;

    @Autowired
    protected LedgerService ledgerService;

    @Autowired
    protected ChannelService channelService;

    @Autowired
    protected ChannelVerifier channelVerifier;

    @Autowired
    protected CampaignCommandService commands;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected SimulatedTelegramGateway gateway;

    @BeforeEach
    void resetSharedState() {
        clock.set(START);
        gateway.reset();
    }

    protected User newUser(UserRole role) {
        long externalId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE);
        return userService.register(externalId, "user-" + externalId, role);
    }

    protected void topUp(UUID userId, long amount) {
        ledgerService.credit(userId, amount, "test-topup:" + UUID.randomUUID(), TransactionKind.TOPUP);
    }

    /**
     * Registers a channel on the simulated platform and verifies it for {@code ownerId}.
     */
    protected Channel verifiedChannel(UUID ownerId) {
        String externalId = "@chan-" + UUID.randomUUID().toString().substring(0, 8);
        gateway.registerChannel(externalId);
        Channel channel = channelService.register(ownerId, externalId, "Channel " + externalId);
        channelVerifier.verify(channel.getId());
        return channelService.require(channel.getId());
    }

    /**
     * Creates and funds a campaign, leaving it OFFERED.
     */
    protected Campaign offeredCampaign(UUID advertiserId, long budget) {
        Campaign created = commands.createCampaign(advertiserId, "Ad for " + advertiserId, budget,
                null, UUID.randomUUID().toString()).getCampaign();
        return commands.fundCampaign(advertiserId, created.getId());
    }

    @TestConfiguration
    static class TestClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(START);
        }
    }
}
