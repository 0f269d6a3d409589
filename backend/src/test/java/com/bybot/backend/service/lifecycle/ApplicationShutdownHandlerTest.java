package com.bybot.backend.service.lifecycle;

import org.junit.jupiter.api.Test;
import org.springframework.context.ConfigurableApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ApplicationShutdownHandlerTest {

    @Test
    void closesContextOnceEvenWhenRequestedTwice() {
        ConfigurableApplicationContext context = mock(ConfigurableApplicationContext.class);
        ApplicationShutdownHandler handler = new ApplicationShutdownHandler(context, false);

        handler.shutdown("api_client unrecoverable");
        handler.shutdown("order_engine unrecoverable");

        assertThat(handler.isRequested()).isTrue();
        verify(context, after(500).times(1)).close();
    }

    @Test
    void notRequestedUntilShutdownIsCalled() {
        ApplicationShutdownHandler handler =
                new ApplicationShutdownHandler(mock(ConfigurableApplicationContext.class), false);

        assertThat(handler.isRequested()).isFalse();
    }
}
