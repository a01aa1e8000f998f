package io.intellixity.polystage.app.cli;

import io.intellixity.polystage.json.PlanJsonReader;
import io.intellixity.polystage.json.ResultJson;
import io.intellixity.polystage.model.PipelineResult;
import io.intellixity.polystage.model.Plan;
import io.intellixity.polystage.pipeline.PipelineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Executes every {@code --plan=<file>} argument and prints the JSON result of each. */
public final class PlanFileRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(PlanFileRunner.class);
  static final String OPTION = "plan";

  private final PipelineExecutor executor;
  private final PrintStream out;

  public PlanFileRunner(PipelineExecutor executor) {
    this(executor, System.out);
  }

  PlanFileRunner(PipelineExecutor executor, PrintStream out) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    List<String> files = args.getOptionValues(OPTION);
    if (files == null || files.isEmpty()) return;
    for (String f : files) {
      Path path = Path.of(f);
      Plan plan;
      try (InputStream in = Files.newInputStream(path)) {
        plan = PlanJsonReader.read(in);
      }
      log.info("polystage.cli op=run file={} stages={} fingerprint={}", path, plan.size(), plan.fingerprint());
      PipelineResult result = executor.execute(plan);
      out.println(ResultJson.write(result, true));
    }
  }
}
