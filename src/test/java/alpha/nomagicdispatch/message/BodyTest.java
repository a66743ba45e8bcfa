package alpha.nomagicdispatch.message;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Small tests of {@link Body}.
 * 
 * @author Martin Andersson (webmaster at martinandersson.com)
 */
class BodyTest
{
    @Test
    void bytes_copiedInAndOut() {
        byte[] src = {1, 2, 3};
        var b = (Body.Bytes) Body.bytes(src);
        src[0] = 9;
        b.value()[1] = 9;
        b.toBytes()[2] = 9;
        assertThat(b.value()).containsExactly(1, 2, 3);
        assertThat(b).isEqualTo(Body.bytes(new byte[]{1, 2, 3}));
    }
}
