package io.cardwatch.history.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * On-disk layout of the history file. The field names are kept for compatibility with existing
 * files.
 */
@Builder
@Getter
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryFile {
  @Nullable
  @JsonProperty("ultima_verificacao")
  private String lastCheckedAt;

  @JsonProperty("total_verificacoes")
  private int checkCount;

  @Nullable
  @JsonProperty("arquivos_processados")
  private List<String> processedIds;
}
