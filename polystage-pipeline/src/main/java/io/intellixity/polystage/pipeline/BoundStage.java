package io.intellixity.polystage.pipeline;

import io.intellixity.polystage.model.Stage;
import io.intellixity.polystage.schema.FieldType;
import io.intellixity.polystage.template.Placeholder;

import java.util.List;
import java.util.Objects;

/** A stage whose placeholders have their target types looked up in the target backend's schema. */
public record BoundStage(Stage stage, List<Target> targets) {
  public BoundStage {
    Objects.requireNonNull(stage, "stage");
    targets = List.copyOf(targets);
  }

  public record Target(Placeholder placeholder, FieldType type) {
    public Target {
      Objects.requireNonNull(placeholder, "placeholder");
      Objects.requireNonNull(type, "type");
    }
  }
}
