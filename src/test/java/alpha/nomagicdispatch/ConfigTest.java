package alpha.nomagicdispatch;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static alpha.nomagicdispatch.Config.DEFAULT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link Config}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class ConfigTest {
    @Test
    void defaults() {
        assertThat(DEFAULT.accessLogging()).isTrue();
        assertThat(DEFAULT.timeoutDispatch()).isEqualTo(Duration.ofSeconds(90));
        assertThat(DEFAULT.maxRequestBodySize()).isEqualTo(20 * 1024 * 1024);
    }
    
    @Test
    void parentStateUnaffected() {
        final int was = DEFAULT.maxRequestBodySize();
        final var mod = DEFAULT.toBuilder().maxRequestBodySize(123).build();
        
        // Default not modified
        assertThat(DEFAULT.maxRequestBodySize()).isEqualTo(was);
        // Mod is
        assertThat(mod.maxRequestBodySize()).isEqualTo(123);
    }
    
    @Test
    void builderIsReusable() {
        var b = Config.configuration().accessLogging(false);
        var one = b.timeoutDispatch(Duration.ofSeconds(1)).build();
        var two = b.build();
        assertThat(one.accessLogging()).isFalse();
        assertThat(two.accessLogging()).isFalse();
        assertThat(one.timeoutDispatch()).isEqualTo(Duration.ofSeconds(1));
        assertThat(two.timeoutDispatch()).isEqualTo(Duration.ofSeconds(90));
        assertThat(one.toBuilder().build().timeoutDispatch()).isEqualTo(Duration.ofSeconds(1));
    }
    
    @Test
    void negativeBodySize() {
        assertThatThrownBy(() -> DEFAULT.toBuilder().maxRequestBodySize(-1))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("Negative: -1");
    }
}
