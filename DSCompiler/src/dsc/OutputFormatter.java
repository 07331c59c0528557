package dsc;

/** Cosmetic reformatting of emitted step code. */
public interface OutputFormatter {
  String format(String code);
}
