package com.nosota.xswap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nosota.xswap.api.model.SwapDirection;
import com.nosota.xswap.gateway.BridgeTransport;
import com.nosota.xswap.gateway.CustodyGateway;
import com.nosota.xswap.gateway.DestinationExecutor;
import com.nosota.xswap.gateway.ExchangeGateway;
import com.nosota.xswap.model.Swap;
import com.nosota.xswap.service.ExpiryReconciler;
import com.nosota.xswap.service.RefundEngine;
import com.nosota.xswap.service.SagaExecutor;
import com.nosota.xswap.service.SwapLedger;
import com.nosota.xswap.service.SwapStatisticService;
import com.nosota.xswap.support.MutableClock;
import com.nosota.xswap.support.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base of the integration tests: PostgreSQL in a container, collaborators mocked,
 * a clock the tests can move. Requires a Docker daemon.
 */
@SpringBootTest(
        classes = XswapApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {"spring.main.allow-bean-definition-overriding=true"}
)
@AutoConfigureMockMvc
@Testcontainers
@Import(TestClockConfig.class)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    protected static final String ETH_ADDRESS = "0x" + "ab".repeat(20);
    protected static final String SUI_ADDRESS = "0x" + "cd".repeat(32);
    protected static final int SUI_DOMAIN = 8;
    protected static final int ETH_DOMAIN = 0;

    @MockBean
    protected ExchangeGateway exchangeGateway;

    @MockBean
    protected BridgeTransport bridgeTransport;

    @MockBean
    protected DestinationExecutor destinationExecutor;

    @MockBean
    protected CustodyGateway custodyGateway;

    @Autowired
    protected SagaExecutor sagaExecutor;

    @Autowired
    protected SwapLedger swapLedger;

    @Autowired
    protected RefundEngine refundEngine;

    @Autowired
    protected ExpiryReconciler expiryReconciler;

    @Autowired
    protected SwapStatisticService swapStatisticService;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    // Counter for generating unique owners in tests
    private static final AtomicLong ownerCounter = new AtomicLong(1);

    @BeforeEach
    void resetClock() {
        clock.setInstant(Instant.now());
    }

    protected String newOwner() {
        return "owner-" + ownerCounter.getAndIncrement();
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Helper method to create an A_TO_B swap (ETH → SUI) due in one hour.
     */
    protected Swap createSwap(String owner, long inputAmount, long minOutputAmount) {
        return sagaExecutor.create(owner, SwapDirection.A_TO_B, inputAmount, minOutputAmount,
                SUI_ADDRESS, SUI_DOMAIN, now().plus(Duration.ofHours(1)));
    }
}
