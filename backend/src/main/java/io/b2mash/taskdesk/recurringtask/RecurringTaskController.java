package io.b2mash.taskdesk.recurringtask;

import io.b2mash.taskdesk.member.MemberContext;
import io.b2mash.taskdesk.recurrence.FiscalPeriod;
import io.b2mash.taskdesk.recurringtask.dto.AuditEventResponse;
import io.b2mash.taskdesk.recurringtask.dto.BulkSaveCompletionsRequest;
import io.b2mash.taskdesk.recurringtask.dto.ClientProgressResponse;
import io.b2mash.taskdesk.recurringtask.dto.CompletionBatchResponse;
import io.b2mash.taskdesk.recurringtask.dto.CompletionEntryRequest;
import io.b2mash.taskdesk.recurringtask.dto.CreateRecurringTaskRequest;
import io.b2mash.taskdesk.recurringtask.dto.RecurringTaskResponse;
import io.b2mash.taskdesk.recurringtask.dto.UpdateRecurringTaskRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recurring-tasks")
public class RecurringTaskController {

  private final RecurringTaskService taskService;

  public RecurringTaskController(RecurringTaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping
  public ResponseEntity<List<RecurringTaskResponse>> listTasks(
      @RequestParam(required = false) String status,
      @RequestParam(required = false) String priority,
      @RequestParam(required = false) String categoryId,
      @RequestParam(required = false) String search) {
    return ResponseEntity.ok(taskService.list(status, priority, categoryId, search));
  }

  @GetMapping("/{id}")
  public ResponseEntity<RecurringTaskResponse> getTask(@PathVariable UUID id) {
    return ResponseEntity.ok(taskService.get(id));
  }

  @PostMapping
  public ResponseEntity<RecurringTaskResponse> createTask(
      @Valid @RequestBody CreateRecurringTaskRequest request) {
    String memberId = MemberContext.requireMemberId();
    var response = taskService.create(request, memberId);
    return ResponseEntity.created(URI.create("/api/recurring-tasks/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<RecurringTaskResponse> updateTask(
      @PathVariable UUID id, @Valid @RequestBody UpdateRecurringTaskRequest request) {
    return ResponseEntity.ok(taskService.update(id, request));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTask(
      @PathVariable UUID id, @RequestParam(required = false) String option) {
    taskService.delete(id, DeleteOption.fromValue(option));
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/pause")
  public ResponseEntity<RecurringTaskResponse> pauseTask(@PathVariable UUID id) {
    return ResponseEntity.ok(taskService.pause(id));
  }

  @PostMapping("/{id}/resume")
  public ResponseEntity<RecurringTaskResponse> resumeTask(@PathVariable UUID id) {
    return ResponseEntity.ok(taskService.resume(id));
  }

  @PostMapping("/{id}/advance")
  public ResponseEntity<RecurringTaskResponse> advanceTask(@PathVariable UUID id) {
    return ResponseEntity.ok(taskService.advanceOccurrence(id));
  }

  @GetMapping("/{id}/periods")
  public ResponseEntity<List<FiscalPeriod>> listPeriods(
      @PathVariable UUID id, @RequestParam(required = false) Integer fiscalYear) {
    return ResponseEntity.ok(taskService.periods(id, fiscalYear));
  }

  @GetMapping("/{id}/visible-clients")
  public ResponseEntity<List<String>> listVisibleClients(@PathVariable UUID id) {
    return ResponseEntity.ok(
        taskService.visibleClients(
            id, MemberContext.requireMemberId(), MemberContext.getRole()));
  }

  @GetMapping("/{id}/progress")
  public ResponseEntity<List<ClientProgressResponse>> getProgress(
      @PathVariable UUID id, @RequestParam(required = false) Integer fiscalYear) {
    return ResponseEntity.ok(
        taskService.progress(
            id, fiscalYear, MemberContext.requireMemberId(), MemberContext.getRole()));
  }

  @GetMapping("/{id}/completions")
  public ResponseEntity<Map<String, Set<String>>> getCompletions(
      @PathVariable UUID id, @RequestParam(required = false) String clientId) {
    return ResponseEntity.ok(taskService.loadCompletions(id, clientId));
  }

  @PutMapping("/{id}/completions")
  public ResponseEntity<CompletionBatchResponse> saveCompletions(
      @PathVariable UUID id, @Valid @RequestBody BulkSaveCompletionsRequest request) {
    String memberId = MemberContext.requireMemberId();
    var updates = request.entries().stream().map(CompletionEntryRequest::toUpdate).toList();
    var result = taskService.saveCompletions(id, updates, memberId);
    return ResponseEntity.ok(CompletionBatchResponse.of(id, result));
  }

  @GetMapping("/{id}/history")
  public ResponseEntity<List<AuditEventResponse>> getHistory(@PathVariable UUID id) {
    return ResponseEntity.ok(taskService.history(id));
  }
}
