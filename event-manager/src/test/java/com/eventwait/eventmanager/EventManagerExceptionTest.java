package com.eventwait.eventmanager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventManagerException Tests")
class EventManagerExceptionTest {
    
    @Test
    @DisplayName("Should create exception with message and cause")
    void shouldCreateExceptionWithMessageAndCause() {
        Throwable cause = new IllegalStateException("Root cause");
        
        EventManagerException exception = new EventManagerException("Test error message", cause);
        
        assertThat(exception)
            .isInstanceOf(RuntimeException.class)
            .hasMessage("Test error message")
            .hasCause(cause);
    }
    
    @Test
    @DisplayName("Wait timeout should describe the event and the timeout")
    void waitTimeoutShouldDescribeEventAndTimeout() {
        WaitTimeoutException exception = new WaitTimeoutException("on_ready", Duration.ofMillis(250));
        
        assertThat(exception)
            .isInstanceOf(EventManagerException.class)
            .hasMessageContaining("on_ready")
            .hasMessageContaining("250 ms")
            .hasNoCause();
        assertThat(exception.getEventName()).isEqualTo("on_ready");
        assertThat(exception.getTimeout()).isEqualTo(Duration.ofMillis(250));
    }
    
    @Test
    @DisplayName("Loop timeout should report how many events were delivered")
    void loopTimeoutShouldReportDeliveredCount() {
        LoopTimeoutException exception = new LoopTimeoutException("on_message", 2);
        
        assertThat(exception)
            .isInstanceOf(EventManagerException.class)
            .hasMessageContaining("on_message")
            .hasMessageContaining("2 delivered");
        assertThat(exception.getEventName()).isEqualTo("on_message");
        assertThat(exception.getDeliveredCount()).isEqualTo(2);
    }
    
    @Test
    @DisplayName("Closed and exhausted conditions should be manager exceptions")
    void closedAndExhaustedShouldBeManagerExceptions() {
        assertThat(new EventManagerClosedException("closed")).isInstanceOf(EventManagerException.class);
        assertThat(new StreamExhaustedException("on_message"))
            .isInstanceOf(EventManagerException.class)
            .hasMessageContaining("on_message");
    }
}
