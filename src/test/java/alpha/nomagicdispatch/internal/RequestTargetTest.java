package alpha.nomagicdispatch.internal;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Small tests of {@link RequestTarget}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class RequestTargetTest
{
    private RequestTarget testee;
    
    @Test
    void originForm() {
        init("/seg/ment?q=1&r=2#frag");
        expPath("/seg/ment");
        expQuery(entry("q", "1"), entry("r", "2"));
    }
    
    @Test
    void absoluteForm() {
        init("http://www.example.com:8080/where?q=now");
        expPath("/where");
        expQuery(entry("q", "now"));
    }
    
    @Test
    void absoluteForm_noPath() {
        init("http://www.example.com?q=now");
        expPath("/");
        expQuery(entry("q", "now"));
    }
    
    @Test
    void queryDecoded_pathNot() {
        init("/s%20t?k%20y=v+l");
        expPath("/s%20t");
        expQuery(entry("k y", "v l"));
    }
    
    @Test
    void lastValueWins() {
        init("/?q=1&q=2");
        expQuery(entry("q", "2"));
    }
    
    @Test
    void keyOnly_emptyPairs() {
        init("/?flag&&x=");
        expQuery(entry("flag", ""), entry("x", ""));
    }
    
    @Test
    void malformedEscape_keptAsIs() {
        init("/?a=%G1");
        expQuery(entry("a", "%G1"));
    }
    
    // Remaining of all these test cases are basically just to bump code coverage
    
    @Test
    void empty() {
        init("");
        expPath("/");
        expQuery();
    }
    
    @Test
    void fragment_only() {
        init("#");
        expPath("/");
        expQuery();
    }
    
    @Test
    void query_only() {
        init("?");
        expPath("/");
        expQuery();
    }
    
    @Test
    void fragmentBeforeQuery_queryIgnored() {
        init("/a#b?c=d");
        expPath("/a");
        expQuery();
    }
    
    private void init(String target) {
        testee = RequestTarget.parse(target);
    }
    
    private void expPath(String path) {
        assertThat(testee.path()).isEqualTo(path);
    }
    
    @SafeVarargs
    private void expQuery(Map.Entry<String, String>... entries) {
        assertThat(testee.query()).containsExactly(entries);
    }
}
