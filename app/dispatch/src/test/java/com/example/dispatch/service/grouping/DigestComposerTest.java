/*
 * どこで: Dispatch grouping のユニットテスト
 * 何を: 集約戦略ごとの digest 文面と優先度/チャネルの合成を検証する
 * なぜ: 窓の内容が digest に正しく要約されることを担保するため
 */
package com.example.dispatch.service.grouping;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.model.AggregationStrategy;
import com.example.dispatch.model.GroupMember;
import com.example.dispatch.model.GroupWindow;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.model.Priority;
import com.example.dispatch.model.WindowState;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class DigestComposerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");

  private final DigestComposer composer = new DigestComposer();

  @Test
  void singleMemberPassesThroughWithItsOwnJobId() {
    final GroupMember member = member(0, Priority.LOW, "Alice liked your post", List.of("push"));

    final NotificationJob job = composer.compose(window(AggregationStrategy.COUNT), List.of(member));

    assertThat(job.jobId()).isEqualTo(member.jobId());
    assertThat(job.payload()).isEqualTo(member.payload());
    assertThat(job.groupKey()).isEqualTo("u_1:social.like:p-1");
  }

  @Test
  void countDigestTakesHighestPriorityAndChannelUnion() {
    final GroupWindow window = window(AggregationStrategy.COUNT);
    final List<GroupMember> members =
        List.of(
            member(0, Priority.LOW, "Alice liked your post", List.of("push")),
            member(1, Priority.HIGH, "Bob liked your post", List.of("email", "push")),
            member(2, Priority.MEDIUM, "Carol liked your post", List.of("in_app")));

    final NotificationJob digest = composer.compose(window, members);

    assertThat(digest.jobId()).isEqualTo(DigestComposer.digestJobId(window.windowId()));
    assertThat(digest.priority()).isEqualTo(Priority.HIGH);
    assertThat(digest.payload().channels()).containsExactly("push", "email", "in_app");
    assertThat(digest.payload().title()).isEqualTo("3 social.like notifications");
    assertThat(digest.payload().body()).isEqualTo("You have 3 social.like notifications");
    assertThat(digest.payload().data())
        .containsEntry("member_count", 3)
        .containsEntry(
            "member_job_ids", members.stream().map(member -> member.jobId().toString()).toList());
    assertThat(digest.createdAt()).isEqualTo(NOW);
  }

  @Test
  void listDigestShowsFirstFiveTitlesAndRemainder() {
    final List<GroupMember> members = new ArrayList<>();
    for (int i = 0; i < 7; i++) {
      members.add(member(i, Priority.LOW, "t" + i, List.of("push")));
    }

    final String body = composer.summarize(window(AggregationStrategy.LIST), members);

    assertThat(body).isEqualTo("t0, t1, t2, t3, t4 and 2 more");
  }

  @Test
  void summaryAndDigestStrategiesUseFixedWording() {
    final List<GroupMember> members =
        List.of(
            member(0, Priority.LOW, "first", List.of("push")),
            member(1, Priority.LOW, "second", List.of("push")));

    assertThat(composer.summarize(window(AggregationStrategy.SUMMARY), members))
        .isEqualTo("2 notifications: first");
    assertThat(composer.summarize(window(AggregationStrategy.DIGEST), members))
        .isEqualTo("Digest: 2 notifications");
  }

  private static GroupWindow window(AggregationStrategy strategy) {
    return new GroupWindow(
        UUID.randomUUID(),
        "u_1:social.like:p-1",
        "u_1",
        "social.like",
        strategy,
        NOW,
        NOW.plusSeconds(300),
        WindowState.FLUSHING,
        0,
        null,
        NOW,
        NOW,
        null);
  }

  private static GroupMember member(int position, Priority priority, String title, List<String> channels) {
    return new GroupMember(
        UUID.randomUUID(),
        position,
        UUID.randomUUID(),
        "u_1",
        "social.like",
        priority,
        new NotificationPayload("u_1", title, title + " body", channels, Map.of("post_id", "p-1")),
        3,
        "trace-" + position,
        NOW.plusSeconds(position));
  }
}
