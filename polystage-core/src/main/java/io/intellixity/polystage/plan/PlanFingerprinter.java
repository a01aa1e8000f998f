package io.intellixity.polystage.plan;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.polystage.json.Json;
import io.intellixity.polystage.model.BackendKind;
import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.template.TemplateNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Stable plan fingerprint.\n
 *
 * Per stage: {@code index|backend|normalized template|parameters as JSON|output label|output keys}, one line
 * per stage in ordinal order, hashed with SHA-256. Parameter order is significant (insertion order).\n
 *
 * Relational templates are case-folded (PostgreSQL folds unquoted keywords and identifiers); Cypher labels
 * and document field names are case-sensitive, so graph and document templates keep their casing.\n
 */
public final class PlanFingerprinter {
  private PlanFingerprinter() {}

  public static String fingerprint(List<Stage> stages) {
    StringBuilder sb = new StringBuilder(256);
    for (Stage s : stages) {
      sb.append(s.index()).append('|')
          .append(s.backend().schemaKey()).append('|')
          .append(TemplateNormalizer.normalize(s.queryTemplate(), s.backend() == BackendKind.RELATIONAL)).append('|')
          .append(parametersJson(s)).append('|')
          .append(s.outputLabel() == null ? "" : s.outputLabel()).append('|')
          .append(String.join(",", s.outputKeys()))
          .append('\n');
    }
    return sha256(sb.toString());
  }

  private static String parametersJson(Stage s) {
    try {
      return Json.mapper().writeValueAsString(s.parameters());
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Stage " + s.index() + " parameters are not JSON-serializable", e);
    }
  }

  static String sha256(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
