package dsc;

/**
 * Which lines open a new nesting level while {@link DirectiveScanner} looks for a closing
 * directive.
 */
public enum Opener {
  PLAIN_IF {
    @Override
    public boolean opens(String line) {
      return Directive.isPlainIf(line);
    }
  },
  FIRST_IF_OPTION {
    @Override
    public boolean opens(String line) {
      return Directive.isFirstIfOption(line);
    }
  },
  ANY_IF_OPTION {
    @Override
    public boolean opens(String line) {
      return Directive.IF_OPTION.matches(line);
    }
  },
  CHOICE {
    @Override
    public boolean opens(String line) {
      return Directive.CHOICE.matches(line);
    }
  };

  public abstract boolean opens(String line);
}
