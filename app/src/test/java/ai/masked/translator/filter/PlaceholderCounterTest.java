package ai.masked.translator.filter;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PlaceholderCounterTest {

    @Test
    void issuesSequentialTokensStartingAtZero() {
        PlaceholderCounter counter = new PlaceholderCounter();

        assertThat(counter.next()).isEqualTo("@@0@@");
        assertThat(counter.next()).isEqualTo("@@1@@");
        assertThat(counter.next()).isEqualTo("@@2@@");
        assertThat(counter.current()).isEqualTo(3);
    }

    @Test
    void detectsTokenSyntax() {
        assertThat(PlaceholderCounter.containsToken("keep @@12@@ here")).isTrue();
        assertThat(PlaceholderCounter.containsToken("@@x@@ and @@ 1 @@")).isFalse();
        assertThat(PlaceholderCounter.containsToken(null)).isFalse();
    }
}
