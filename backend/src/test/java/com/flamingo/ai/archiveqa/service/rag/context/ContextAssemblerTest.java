package com.flamingo.ai.archiveqa.service.rag.context;

import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.SCOPE;
import static com.flamingo.ai.archiveqa.service.rag.CandidateFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.archiveqa.service.directory.UserDirectoryService;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ContextAssembler Tests")
class ContextAssemblerTest {

  @Mock private UserDirectoryService userDirectory;

  private ContextAssembler assembler;

  @BeforeEach
  void setUp() {
    assembler = new ContextAssembler(new MentionResolver(userDirectory));
  }

  @Test
  @DisplayName("Should render numbered blocks separated by a blank line")
  void shouldRenderBlocks() {
    String context =
        assembler.assemble(
            SCOPE,
            List.of(
                candidate("The API freeze starts Monday", "engineering", "alice"),
                candidate("Demo day moved to Friday", "hackathons", "bob")));

    assertThat(context)
        .isEqualTo(
            "[Message 1] [#engineering] (from alice):\nThe API freeze starts Monday"
                + "\n\n"
                + "[Message 2] [#hackathons] (from bob):\nDemo day moved to Friday");
  }

  @Test
  @DisplayName("Should use inline mention names without a directory call")
  void shouldUseInlineMentionNames() {
    String context = assembler.assemble(SCOPE, List.of(candidate("<@U1|alice> will ship the fix")));

    assertThat(context).contains("@alice will ship the fix").doesNotContain("<@U1|alice>");
    verifyNoInteractions(userDirectory);
  }

  @Test
  @DisplayName("Should resolve bare mentions across all messages in one lookup")
  void shouldBatchResolveMentions() {
    when(userDirectory.resolve(SCOPE, Set.of("U1", "U2")))
        .thenReturn(Map.of("U1", "Alice Smith", "U2", "bob"));

    String context =
        assembler.assemble(
            SCOPE,
            List.of(
                candidate("<@U1> reviewed the PR from <@U2>"),
                candidate("thanks <@U2>, merging now")));

    assertThat(context)
        .contains("@Alice Smith reviewed the PR from @bob")
        .contains("thanks @bob, merging now");
    verify(userDirectory, times(1)).resolve(any(), any());
  }

  @Test
  @DisplayName("Should keep raw ids for users the directory does not know")
  void shouldKeepRawIdsForUnknownUsers() {
    when(userDirectory.resolve(SCOPE, Set.of("U9"))).thenReturn(Map.of());

    String context = assembler.assemble(SCOPE, List.of(candidate("ask <@U9> about the rollout")));

    assertThat(context).contains("ask @U9 about the rollout");
  }

  @Test
  @DisplayName("Should keep raw ids when the directory lookup fails")
  void shouldKeepRawIdsOnLookupFailure() {
    when(userDirectory.resolve(any(), any())).thenThrow(new IllegalStateException("db down"));

    String context = assembler.assemble(SCOPE, List.of(candidate("ask <@U9> about the rollout")));

    assertThat(context).contains("ask @U9 about the rollout");
  }

  @Test
  @DisplayName("Should return an empty context for no messages")
  void shouldReturnEmptyForNoMessages() {
    assertThat(assembler.assemble(SCOPE, List.of())).isEmpty();
    verifyNoInteractions(userDirectory);
  }
}
