package alpha.nomagicdispatch.route;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Small tests of {@link PathPattern}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class PathPatternTest
{
    @Test
    void paramBound() {
        var r = PathPattern.parse("/users/:id").match("/users/42");
        assertThat(r.matched()).isTrue();
        assertThat(r.parameters()).containsExactly(Map.entry("id", "42"));
    }
    
    @Test
    void segmentCountMismatch() {
        var r = PathPattern.parse("/users/:id").match("/users/42/profile");
        assertThat(r.matched()).isFalse();
        assertThat(r.parameters()).isEmpty();
    }
    
    @Test
    void literalMismatch_paramsDiscarded() {
        var r = PathPattern.match("/users/42/posts", "/users/:id/profile");
        assertThat(r.matched()).isFalse();
        assertThat(r.parameters()).isEmpty();
    }
    
    @Test
    void manyParams() {
        var r = PathPattern.parse("/a/:x/b/:y").match("/a/1/b/2");
        assertThat(r.parameters()).containsOnly(
                Map.entry("x", "1"), Map.entry("y", "2"));
    }
    
    @Test
    void literalEquality_noParams() {
        var r = PathPattern.match("/users/:id", "/users/:id");
        assertThat(r.matched()).isTrue();
        assertThat(r.parameters()).isEmpty();
    }
    
    @Test
    void root() {
        var p = PathPattern.parse("/");
        assertThat(p.match("/").matched()).isTrue();
        assertThat(p.match("/x").matched()).isFalse();
    }
    
    @Test
    void caseSensitive_noDecoding() {
        var p = PathPattern.parse("/Users/a%20b");
        assertThat(p.match("/users/a%20b").matched()).isFalse();
        assertThat(p.match("/Users/a b").matched()).isFalse();
        assertThat(p.match("/Users/a%20b").matched()).isTrue();
    }
    
    @Test
    void trailingSlashIsASegment() {
        var p = PathPattern.parse("/users/:id");
        assertThat(p.match("/users/42/").matched()).isFalse();
        // Empty segment binds
        assertThat(p.match("/users/").parameters()).containsExactly(Map.entry("id", ""));
    }
    
    @Test
    void deterministic() {
        var p = PathPattern.parse("/users/:id");
        var one = p.match("/users/7");
        var two = p.match("/users/7");
        assertThat(one).isEqualTo(two);
        assertThat(p.match("/users/8").parameters()).containsExactly(Map.entry("id", "8"));
    }
    
    @Test
    void paramNames() {
        assertThat(PathPattern.parse("/:a/x/:b").paramNames()).containsExactly("a", "b");
    }
    
    @Test
    void prefixed() {
        var p = PathPattern.parse("/ping");
        assertThat(p.prefixed("/")).isSameAs(p);
        assertThat(p.prefixed("/api")).hasToString("/api/ping");
        assertThat(PathPattern.parse("/").prefixed("/api").match("/api/").matched()).isTrue();
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"users", "", "/files/*", "/*", "/a/:", "/:id/:id"})
    void invalid(String pattern) {
        assertThatThrownBy(() -> PathPattern.parse(pattern))
            .isExactlyInstanceOf(RoutePatternInvalidException.class)
            .extracting(e -> ((RoutePatternInvalidException) e).getPattern())
            .isEqualTo(pattern);
    }
    
    @Test
    void duplicateParam_message() {
        assertThatThrownBy(() -> PathPattern.parse("/:id/x/:id"))
            .hasMessageContaining("Duplicated parameter name \"id\".");
    }
}
