/*
 * どこで: Dispatch grouping
 * 何を: flush 対象の窓メンバーから digest ジョブを組み立てる
 * なぜ: 複数の候補を 1 通の要約通知へまとめ、通知疲れを抑えるため
 */
package com.example.dispatch.service.grouping;

import com.example.dispatch.model.GroupMember;
import com.example.dispatch.model.GroupWindow;
import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.NotificationPayload;
import com.example.dispatch.model.Priority;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class DigestComposer {

  static final int LIST_PREVIEW_SIZE = 5;

  /**
   * 窓の digest ジョブを返す。
   *
   * <p>メンバーが 1 件だけなら、そのメンバーを元の jobId と payload のまま返す。
   */
  public NotificationJob compose(GroupWindow window, List<GroupMember> members) {
    if (members.isEmpty()) {
      throw new IllegalArgumentException("window has no members windowId=" + window.windowId());
    }
    if (members.size() == 1) {
      final GroupMember only = members.get(0);
      return NotificationJob.builder()
          .jobId(only.jobId())
          .userId(only.userId())
          .type(only.type())
          .priority(only.priority())
          .payload(only.payload())
          .state(JobState.PENDING)
          .maxAttempts(only.maxAttempts())
          .groupKey(window.groupKey())
          .traceId(only.traceId())
          .createdAt(only.createdAt())
          .build();
    }
    final GroupMember first = members.get(0);
    final Priority priority =
        members.stream().map(GroupMember::priority).reduce(Priority::max).orElse(first.priority());
    final Set<String> channels = new LinkedHashSet<>();
    members.forEach(member -> channels.addAll(member.payload().channels()));

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("group_key", window.groupKey());
    data.put("window_id", window.windowId().toString());
    data.put("member_count", members.size());
    data.put("member_job_ids", members.stream().map(member -> member.jobId().toString()).toList());

    final NotificationPayload payload =
        new NotificationPayload(
            first.payload().recipient(),
            members.size() + " " + window.type() + " notifications",
            summarize(window, members),
            List.copyOf(channels),
            data);
    return NotificationJob.builder()
        .jobId(digestJobId(window.windowId()))
        .userId(window.userId())
        .type(window.type())
        .priority(priority)
        .payload(payload)
        .state(JobState.PENDING)
        .maxAttempts(members.stream().mapToInt(GroupMember::maxAttempts).max().orElse(0))
        .groupKey(window.groupKey())
        .traceId(first.traceId())
        .createdAt(
            members.stream()
                .map(GroupMember::createdAt)
                .min(Comparator.naturalOrder())
                .orElse(first.createdAt()))
        .build();
  }

  static UUID digestJobId(UUID windowId) {
    return UUID.nameUUIDFromBytes(("digest:" + windowId).getBytes(StandardCharsets.UTF_8));
  }

  String summarize(GroupWindow window, List<GroupMember> members) {
    final int count = members.size();
    return switch (window.strategy()) {
      case COUNT -> "You have " + count + " " + window.type() + " notifications";
      case LIST -> {
        final String items =
            members.stream()
                .limit(LIST_PREVIEW_SIZE)
                .map(this::displayText)
                .collect(Collectors.joining(", "));
        final String more = count > LIST_PREVIEW_SIZE ? " and " + (count - LIST_PREVIEW_SIZE) + " more" : "";
        yield items + more;
      }
      case SUMMARY -> count + " notifications: " + displayText(members.get(0));
      case DIGEST -> "Digest: " + count + " notifications";
    };
  }

  private String displayText(GroupMember member) {
    final NotificationPayload payload = member.payload();
    return payload.title() != null && !payload.title().isBlank() ? payload.title() : payload.body();
  }
}
