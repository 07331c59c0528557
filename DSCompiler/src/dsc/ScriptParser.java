package dsc;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/** Recursive-descent parser from normalized lines to {@link ScriptNode}s. */
public class ScriptParser {
  private static final Logger logger = LoggerFactory.getLogger(ScriptParser.class);

  private static final CharMatcher DIRECTIVE_MARKER = CharMatcher.is(Directive.MARKER);

  private final ScriptLines lines;
  private final CompilerOptions options;

  public ScriptParser(ScriptLines lines, CompilerOptions options) {
    this.lines = lines;
    this.options = options;
  }

  public ImmutableList<ScriptNode> parse() throws CompilerException {
    return parse(lines.all());
  }

  private ImmutableList<ScriptNode> parse(Region region) throws CompilerException {
    ImmutableList.Builder<ScriptNode> nodes = ImmutableList.builder();
    int index = region.start();
    while (index < region.end()) {
      index = parseOne(Region.of(index, region.end()), nodes);
    }
    return nodes.build();
  }

  // Parses the construct at the start of the region and returns the index after it.
  private int parseOne(Region region, ImmutableList.Builder<ScriptNode> nodes)
      throws CompilerException {
    int index = region.start();
    ScriptLine line = lines.get(index);
    String text = line.text();
    logger.debug("parsing line {}: '{}'", line.pos().lineNumber(), text);

    if (text.startsWith("(")) {
      nodes.add(ScriptNode.Comment.create(line.pos(), unwrap(line, '(', ')')));
      return index + 1;
    } else if (text.startsWith("{")) {
      nodes.add(ScriptNode.Action.create(line.pos(), unwrap(line, '{', '}')));
      return index + 1;
    } else if (Directive.isPlainIf(text)) {
      return parseIfElse(region, nodes);
    } else if (Directive.CHOICE.matches(text)) {
      return parseChoice(region, nodes);
    } else if (Directive.isFirstIfOption(text)) {
      return parseBranch(region, nodes);
    }

    if (options.strictDirectives() && text.indexOf(Directive.MARKER) == 0) {
      throw new CompilerException(line.pos(), String.format("unknown directive '%s'", text));
    }
    nodes.add(parseScreen(line));
    return index + 1;
  }

  private String unwrap(ScriptLine line, char open, char close) throws CompilerException {
    String text = line.text();
    if (text.length() < 2 || text.charAt(text.length() - 1) != close) {
      throw new CompilerException(
          line.pos(), String.format("line starting with '%c' must end with '%c'", open, close));
    }
    return text.substring(1, text.length() - 1);
  }

  // *if <condition> ... *else ... *merge if
  private int parseIfElse(Region region, ImmutableList.Builder<ScriptNode> nodes)
      throws CompilerException {
    int ifIndex = region.start();
    ScriptLine ifLine = lines.get(ifIndex);
    Region body = region.after(ifIndex);

    int mergeIndex =
        DirectiveScanner.findFirstUnmatched(lines, body, Directive.MERGE_IF, Opener.PLAIN_IF);
    int elseIndex;
    try {
      elseIndex =
          DirectiveScanner.findFirstUnmatched(
              lines, Region.of(body.start(), mergeIndex), Directive.ELSE, Opener.PLAIN_IF);
    } catch (CompilerException ex) {
      throw new CompilerException(
          ifLine.pos(), "*if has no matching *else before its *merge if: " + ifLine.text());
    }

    ImmutableList<ScriptNode> thenBranch = parse(region.between(ifIndex, elseIndex));
    ImmutableList<ScriptNode> elseBranch = parse(region.between(elseIndex, mergeIndex));
    nodes.add(
        ScriptNode.IfElse.create(ifLine.pos(), condition(ifLine), thenBranch, elseBranch));
    return mergeIndex + 1;
  }

  private static String condition(ScriptLine ifLine) {
    return LineNormalizer.unescapeQuotes(DIRECTIVE_MARKER.trimFrom(ifLine.text()).trim());
  }

  // *choice, one *<option> line per option, *end choice
  private int parseChoice(Region region, ImmutableList.Builder<ScriptNode> nodes)
      throws CompilerException {
    int choiceIndex = region.start();
    ScriptLine choiceLine = lines.get(choiceIndex);
    int endIndex =
        DirectiveScanner.findFirstUnmatched(
            lines, region.after(choiceIndex), Directive.END_CHOICE, Opener.CHOICE);

    List<String> optionTexts = new ArrayList<>();
    for (ScriptLine optionLine : lines.slice(region.between(choiceIndex, endIndex))) {
      String text = optionLine.text();
      if (options.strictDirectives() && text.indexOf(Directive.MARKER) != 0) {
        throw new CompilerException(
            optionLine.pos(), String.format("option lines must start with '*': %s", text));
      }
      optionTexts.add(text.substring(text.lastIndexOf(Directive.MARKER) + 1));
    }

    nodes.add(ScriptNode.Choice.create(choiceLine.pos(), optionTexts));
    return endIndex + 1;
  }

  // *if option 1 ... *end if option ... *if option N ... *end if option *merge option
  private int parseBranch(Region region, ImmutableList.Builder<ScriptNode> nodes)
      throws CompilerException {
    int firstArmIndex = region.start();
    ScriptLine branchLine = lines.get(firstArmIndex);
    int mergeIndex =
        DirectiveScanner.findFirstUnmatched(
            lines, region.after(firstArmIndex), Directive.MERGE_OPTION, Opener.FIRST_IF_OPTION);

    List<ImmutableList<ScriptNode>> arms = new ArrayList<>();
    for (Region armRegion : splitArms(Region.of(firstArmIndex, mergeIndex))) {
      arms.add(parse(armRegion));
    }

    nodes.add(ScriptNode.Branch.create(branchLine.pos(), arms));
    return mergeIndex + 1;
  }

  private ImmutableList<Region> splitArms(Region branch) throws CompilerException {
    ImmutableList.Builder<Region> arms = ImmutableList.builder();
    Region rest = branch;
    while (!rest.isEmpty()) {
      int headerIndex = rest.start();
      ScriptLine header = lines.get(headerIndex);
      if (!Directive.IF_OPTION.matches(header.text())) {
        throw new CompilerException(
            header.pos(), "expected *if option to start a branch arm, found: " + header.text());
      }

      int endIndex =
          DirectiveScanner.findFirstUnmatched(
              lines, rest.after(headerIndex), Directive.END_IF_OPTION, Opener.ANY_IF_OPTION);
      arms.add(rest.between(headerIndex, endIndex));
      rest = rest.after(endIndex);
    }
    return arms.build();
  }

  // Speaker: text, or the player's thought when there is no colon.
  private ScriptNode.Screen parseScreen(ScriptLine line) throws CompilerException {
    String text = line.text();
    int colon = text.indexOf(':');
    if (colon < 0) {
      return ScriptNode.Screen.create(
          line.pos(),
          Speaker.player(options),
          ScriptNode.Screen.Mode.THINKING,
          TextWrapper.wrap(line.pos(), text, options.maxRowLength()),
          options);
    }

    Speaker speaker = Speaker.named(text.substring(0, colon).trim(), options);
    String spoken = text.substring(colon + 1).trim();
    return ScriptNode.Screen.create(
        line.pos(),
        speaker,
        ScriptNode.Screen.Mode.SPEAKING,
        TextWrapper.wrap(line.pos(), spoken, options.maxRowLength()),
        options);
  }
}
