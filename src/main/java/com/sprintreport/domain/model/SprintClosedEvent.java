package com.sprintreport.domain.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SprintClosedEvent {

    @NotBlank
    private String sprintId;

    @NotBlank
    private String githubOwner;

    @NotBlank
    private String githubRepo;
}
