package com.example.pms.router.response;

import com.example.pms.router.model.CandidateAction;
import com.example.pms.router.model.ExtractedEntity;
import com.example.pms.router.model.StepLog;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResponse {
  private String requestId;
  private String lane;
  private String reason;
  private String matchedRule;

  private List<ExtractedEntity> entities;
  private boolean modelExtractionUsed;
  private boolean extractionDegraded;
  private List<CandidateAction> actions;

  private List<StepLog> steps;
  private List<String> notices;
  private String errorCode;
  private List<String> errors;
}
