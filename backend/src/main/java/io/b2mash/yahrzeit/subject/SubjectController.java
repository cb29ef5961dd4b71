package io.b2mash.yahrzeit.subject;

import io.b2mash.yahrzeit.anniversary.AnniversaryCalculator.ObservanceDate;
import io.b2mash.yahrzeit.calendar.HebrewCalendarConverter;
import io.b2mash.yahrzeit.calendar.HebrewDateFormatter;
import io.b2mash.yahrzeit.subject.dto.ChangeDeathDateRequest;
import io.b2mash.yahrzeit.subject.dto.CreateSubjectRequest;
import io.b2mash.yahrzeit.subject.dto.MemorialDatesResponse;
import io.b2mash.yahrzeit.subject.dto.SubjectResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/subjects")
public class SubjectController {

  private final SubjectLifecycleService subjectService;
  private final HebrewCalendarConverter converter;
  private final HebrewDateFormatter formatter;

  public SubjectController(
      SubjectLifecycleService subjectService,
      HebrewCalendarConverter converter,
      HebrewDateFormatter formatter) {
    this.subjectService = subjectService;
    this.converter = converter;
    this.formatter = formatter;
  }

  @PostMapping
  public ResponseEntity<SubjectResponse> createSubject(
      @Valid @RequestBody CreateSubjectRequest request) {
    var subject =
        subjectService.create(request.id(), request.displayName().trim(), request.deathDate());
    return ResponseEntity.created(URI.create("/internal/subjects/" + subject.getId()))
        .body(toResponse(subject));
  }

  @GetMapping("/{id}")
  public ResponseEntity<SubjectResponse> getSubject(@PathVariable UUID id) {
    return ResponseEntity.ok(toResponse(subjectService.get(id)));
  }

  @PutMapping("/{id}/death-date")
  public ResponseEntity<SubjectResponse> changeDeathDate(
      @PathVariable UUID id, @Valid @RequestBody ChangeDeathDateRequest request) {
    return ResponseEntity.ok(toResponse(subjectService.changeDeathDate(id, request.deathDate())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSubject(@PathVariable UUID id) {
    subjectService.delete(id);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/memorial-dates")
  public ResponseEntity<MemorialDatesResponse> memorialDates(@PathVariable UUID id) {
    var dates = subjectService.memorialDates(id);
    return ResponseEntity.ok(
        new MemorialDatesResponse(
            formatter.formatEnglish(dates.deathDateHebrew()),
            toObservance(dates.azkara()),
            toObservance(dates.nextYahrzeit()),
            dates.firstYear()));
  }

  private MemorialDatesResponse.Observance toObservance(ObservanceDate date) {
    return new MemorialDatesResponse.Observance(
        date.gregorianDate(),
        formatter.formatEnglish(date.hebrewDate()),
        formatter.formatHebrew(date.hebrewDate()),
        date.daysUntil());
  }

  private SubjectResponse toResponse(Subject subject) {
    var deathHebrew = subject.getDeathDateHebrew();
    var nextHebrew = converter.toHebrew(subject.getNextOccurrence());
    return new SubjectResponse(
        subject.getId(),
        subject.getDisplayName(),
        subject.getDeathDateGregorian(),
        formatter.formatEnglish(deathHebrew),
        formatter.formatHebrew(deathHebrew),
        subject.getAnniversary().month(),
        subject.getAnniversary().day(),
        subject.getNextOccurrence(),
        formatter.formatEnglish(nextHebrew),
        subject.isStale(),
        subject.getStaleReason(),
        subject.isDeleted(),
        subject.getCreatedAt(),
        subject.getUpdatedAt());
  }
}
