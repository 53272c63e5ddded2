/*
 * どこで: Dispatch 運用 API
 * 何を: ジョブ照会/キュー深さ/dead letter/grouping/schedule の運用操作を提供する
 * なぜ: 障害時の確認と replay をアプリ外から行えるようにするため
 */
package com.example.dispatch.api;

import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import com.example.dispatch.service.JobNotFoundException;
import com.example.dispatch.service.orchestrator.NotificationOrchestrator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ops")
@RequiredArgsConstructor
@Validated
public class DispatchOpsController {

    private final NotificationOrchestrator orchestrator;

    @GetMapping("/jobs/{jobId}")
    public JobStatusResponse job(@PathVariable("jobId") UUID jobId) {
        return orchestrator.getJobStatus(jobId)
                .map(JobStatusResponse::from)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    @GetMapping("/queue/depth")
    public QueueDepthResponse queueDepth(
            @RequestParam(value = "priority", required = false) Priority priority) {
        return new QueueDepthResponse(priority, orchestrator.getQueueDepth(priority));
    }

    @GetMapping("/dead-letters")
    public DeadLettersResponse deadLetters(
            @RequestParam(value = "limit", defaultValue = "50")
            @Min(value = 1, message = "limit must be >= 1")
            @Max(value = 500, message = "limit must be <= 500")
            int limit) {
        List<DeadLetterResponse> items = orchestrator.getRecentDeadLetters(limit).stream()
                .map(DeadLetterResponse::from)
                .toList();
        return new DeadLettersResponse(orchestrator.getDeadLetterCount(), items);
    }

    @GetMapping("/dead-letters/count")
    public long deadLetterCount() {
        return orchestrator.getDeadLetterCount();
    }

    @PostMapping("/dead-letters/{jobId}/replay")
    public DeadLetterResponse replay(@PathVariable("jobId") UUID jobId) {
        return DeadLetterResponse.from(orchestrator.replayDeadLetter(jobId));
    }

    @PostMapping("/groups/{groupKey}/flush")
    public GroupFlushResponse flushGroup(@PathVariable("groupKey") String groupKey) {
        Optional<NotificationJob> digest = orchestrator.flushGroup(groupKey);
        return new GroupFlushResponse(
                groupKey, digest.isPresent(), digest.map(NotificationJob::jobId).orElse(null));
    }

    @DeleteMapping("/schedules/{specId}")
    public ResponseEntity<Void> cancelSchedule(@PathVariable("specId") UUID specId) {
        orchestrator.cancelSchedule(specId);
        return ResponseEntity.noContent().build();
    }
}
