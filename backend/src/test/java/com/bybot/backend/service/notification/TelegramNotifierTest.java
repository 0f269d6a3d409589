package com.bybot.backend.service.notification;

import com.bybot.backend.config.TelegramProperties;
import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThatCode;

class TelegramNotifierTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    private TelegramProperties properties;
    private TelegramNotifier notifier;

    @BeforeAll
    static void startWireMock() {
        wireMock.start();
        configureFor("localhost", wireMock.port());
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        properties = new TelegramProperties();
        properties.setEnabled(true);
        properties.setBotToken("123:abc");
        properties.setChatId("42");
        properties.setApiUrl("http://localhost:" + wireMock.port());
        notifier = new TelegramNotifier(new RestTemplate(), properties);
    }

    @Test
    void postsMessageToChat() {
        stubFor(post(urlEqualTo("/bot123:abc/sendMessage")).willReturn(okJson("{\"ok\":true}")));

        notifier.sendMessage("Failover state changed from NORMAL to DEGRADED");

        verify(postRequestedFor(urlEqualTo("/bot123:abc/sendMessage"))
                .withRequestBody(matchingJsonPath("$.chat_id", equalTo("42")))
                .withRequestBody(matchingJsonPath("$.text", equalTo("Failover state changed from NORMAL to DEGRADED"))));
    }

    @Test
    void disabledNotifierSendsNothing() {
        properties.setEnabled(false);

        notifier.sendMessage("ignored");

        verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    void missingChatIdSendsNothing() {
        properties.setChatId("");

        notifier.sendMessage("ignored");

        verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    void deliveryFailureIsSwallowed() {
        stubFor(post(urlEqualTo("/bot123:abc/sendMessage")).willReturn(serverError()));

        assertThatCode(() -> notifier.sendMessage("EMERGENCY")).doesNotThrowAnyException();
    }
}
