package com.eainde.manuscript.governance.tone;

import com.eainde.manuscript.collaborator.SuggestionTextRewriter;
import com.eainde.manuscript.collaborator.TextRewriter;
import com.eainde.manuscript.model.ToneFlag;
import com.eainde.manuscript.model.ToneSeverity;
import com.eainde.manuscript.model.ToneTerm;
import com.eainde.manuscript.state.RigorLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ToneGovernorTest {

    private final ToneLinter linter = new ToneLinter(TonePolicy.of(
            new ToneTerm("revolutionary", ToneSeverity.FAIL, "significant", "hype"),
            new ToneTerm("novel", ToneSeverity.WARN, "new", "hype")));

    @Mock
    private TextRewriter mockRewriter;

    @Nested
    @DisplayName("Conservative mode")
    class Conservative {

        @Test
        @DisplayName("should rewrite only the failing sentence")
        void rewritesFailingSentence() {
            List<String> fragments = new ArrayList<>();
            List<String> guidance = new ArrayList<>();
            TextRewriter rewriter = (fragment, suggestion) -> {
                fragments.add(fragment);
                guidance.add(suggestion);
                return fragment.replace("revolutionary", "significant");
            };
            ToneGovernor governor = new ToneGovernor(linter, rewriter);

            ToneGovernanceResult result = governor.govern("This is a revolutionary result. It holds.",
                    RigorLevel.CONSERVATIVE);

            assertThat(result.text()).isEqualTo("This is a significant result. It holds.");
            assertThat(result.rewritten()).isTrue();
            assertThat(result.findings()).hasSize(1);
            assertThat(result.remaining()).noneMatch(ToneFlag::failing);
            assertThat(fragments).containsExactly("This is a revolutionary result.");
            assertThat(guidance).containsExactly("significant");
        }

        @Test
        @DisplayName("should never send citation markers to the rewriter")
        void preservesCitations() {
            List<String> fragments = new ArrayList<>();
            TextRewriter rewriter = (fragment, suggestion) -> {
                fragments.add(fragment);
                return fragment.replace("revolutionary", "significant");
            };
            ToneGovernor governor = new ToneGovernor(linter, rewriter);

            ToneGovernanceResult result = governor.govern("A revolutionary claim [[c1]] holds [2].",
                    RigorLevel.CONSERVATIVE);

            assertThat(result.text()).isEqualTo("A significant claim [[c1]] holds [2].");
            assertThat(fragments).containsExactly("A revolutionary claim");
        }

        @Test
        @DisplayName("should throw with the remaining findings when the rewrite does not converge")
        void nonConvergence() {
            ToneGovernor governor = new ToneGovernor(linter, (fragment, suggestion) -> fragment);

            assertThatThrownBy(() -> governor.govern("This is a revolutionary result.", RigorLevel.CONSERVATIVE, "b1"))
                    .isInstanceOf(ToneGovernanceException.class)
                    .hasMessageContaining("b1")
                    .satisfies(e -> {
                        ToneGovernanceException tone = (ToneGovernanceException) e;
                        assertThat(tone.getGate()).isEqualTo("tone");
                        assertThat(tone.getRemaining()).hasSize(1);
                        assertThat(tone.getFlags()).containsExactly("fail:revolutionary@10");
                    });
        }

        @Test
        @DisplayName("should keep the fragment when the rewriter fails, and then refuse")
        void rewriterFailure() {
            ToneGovernor governor = new ToneGovernor(linter, (fragment, suggestion) -> {
                throw new IllegalStateException("model unavailable");
            });

            assertThatThrownBy(() -> governor.govern("A revolutionary idea.", RigorLevel.CONSERVATIVE))
                    .isInstanceOf(ToneGovernanceException.class);
        }

        @Test
        @DisplayName("should keep warn findings without rewriting")
        void warnOnly() {
            ToneGovernor governor = new ToneGovernor(linter, mockRewriter);

            ToneGovernanceResult result = governor.govern("A novel idea.", RigorLevel.CONSERVATIVE);

            assertThat(result.text()).isEqualTo("A novel idea.");
            assertThat(result.rewritten()).isFalse();
            assertThat(result.remaining()).hasSize(1);
            verifyNoInteractions(mockRewriter);
        }

        @Test
        @DisplayName("should converge with the suggestion rewriter, keeping the case of the word")
        void suggestionRewriter() {
            ToneGovernor governor = new ToneGovernor(linter, new SuggestionTextRewriter(linter));

            ToneGovernanceResult result = governor.govern("Revolutionary findings [[c1]]. Nothing else.",
                    RigorLevel.CONSERVATIVE);

            assertThat(result.text()).isEqualTo("Significant findings [[c1]]. Nothing else.");
        }
    }

    @Test
    @DisplayName("should only record findings in exploratory mode")
    void exploratory() {
        ToneGovernor governor = new ToneGovernor(linter, mockRewriter);

        ToneGovernanceResult result = governor.govern("This is a revolutionary result.", RigorLevel.EXPLORATORY);

        assertThat(result.text()).isEqualTo("This is a revolutionary result.");
        assertThat(result.findings()).hasSize(1);
        assertThat(result.rewritten()).isFalse();
        verifyNoInteractions(mockRewriter);
    }
}
