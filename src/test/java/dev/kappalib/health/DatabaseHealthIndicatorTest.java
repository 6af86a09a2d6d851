package dev.kappalib.health;

import io.r2dbc.spi.ConnectionFactory;
import io.r2dbc.spi.ConnectionFactoryMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Status;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.FetchSpec;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DatabaseHealthIndicator")
class DatabaseHealthIndicatorTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private ConnectionFactory connectionFactory;

    @InjectMocks
    private DatabaseHealthIndicator indicator;

    private FetchSpec<Map<String, Object>> fetchSpec;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        GenericExecuteSpec executeSpec = mock(GenericExecuteSpec.class);
        fetchSpec = mock(FetchSpec.class);
        when(databaseClient.sql("SELECT 1")).thenReturn(executeSpec);
        when(executeSpec.fetch()).thenReturn(fetchSpec);
    }

    @Test
    @DisplayName("should report UP when the query succeeds")
    void shouldReportUp() {
        ConnectionFactoryMetadata metadata = mock(ConnectionFactoryMetadata.class);
        when(fetchSpec.first()).thenReturn(Mono.just(Map.of("?column?", 1)));
        when(connectionFactory.getMetadata()).thenReturn(metadata);
        when(metadata.getName()).thenReturn("PostgreSQL");

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("connectionFactory", "PostgreSQL");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report UNKNOWN when the query returns nothing")
    void shouldReportUnknown() {
        when(fetchSpec.first()).thenReturn(Mono.empty());

        StepVerifier.create(indicator.health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.UNKNOWN))
                .verifyComplete();
    }

    @Test
    @DisplayName("should report DOWN with only the error type")
    void shouldReportDown() {
        when(fetchSpec.first()).thenReturn(Mono.error(new IllegalStateException("password authentication failed")));

        StepVerifier.create(indicator.health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("error", "IllegalStateException");
                })
                .verifyComplete();
    }
}
