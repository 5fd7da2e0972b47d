package com.example.pms.router.response;

import com.example.pms.router.model.RelationGroup;
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
public class RelatedResponse {
  private String focusType;
  private String focusId;
  private Double alpha;
  private Integer totalItems;
  private List<RelationGroup> groups;

  private String errorCode;
  private List<String> errors;
}
