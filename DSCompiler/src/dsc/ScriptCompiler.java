package dsc;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

/** Runs a script through normalization, parsing, lowering and emission. */
public class ScriptCompiler {
  private static final Logger logger = LoggerFactory.getLogger(ScriptCompiler.class);

  private final CompilerOptions options;

  public ScriptCompiler(CompilerOptions options) {
    this.options = options;
  }

  public ScriptCompiler() {
    this(CompilerOptions.defaults());
  }

  public ImmutableList<ScriptNode> parse(String file, List<String> rawLines)
      throws CompilerException {
    ImmutableList<ScriptLine> lines = new LineNormalizer(file).normalize(rawLines);
    logger.debug("{}: {} raw lines, {} normalized", file, rawLines.size(), lines.size());
    return new ScriptParser(new ScriptLines(lines), options).parse();
  }

  public ImmutableList<StepBody> lower(List<ScriptNode> nodes) throws CompilerException {
    return new StepLowering(options).lower(nodes);
  }

  /** Compiles the whole script, or fails without producing any output. */
  public String compile(String file, List<String> rawLines) throws CompilerException {
    ImmutableList<ScriptNode> nodes = parse(file, rawLines);
    ImmutableList<StepBody> steps = lower(nodes);
    logger.debug("{}: {} top-level nodes, {} steps", file, nodes.size(), steps.size());
    return StepEmitter.emit(steps);
  }
}
