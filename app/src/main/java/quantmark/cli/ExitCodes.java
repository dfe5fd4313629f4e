package quantmark.cli;

/** Process exit codes shared by all commands. */
final class ExitCodes {
  static final int OK = 0;
  static final int INVALID_INPUT = 1;
  static final int IO_FAILURE = 2;
  static final int NO_GATES = 3;

  private ExitCodes() {}
}
