package io.b2mash.yahrzeit.subject.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.UUID;

public record CreateSubjectRequest(
    @NotNull UUID id,
    @NotBlank @Size(max = 200) String displayName,
    @NotNull @PastOrPresent LocalDate deathDate) {}
