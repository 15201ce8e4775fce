package org.netkat.smt;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers every query with a fixed verdict and keeps the programs it was given.
 */
public class RecordingSolverBackend implements SolverBackend {

  private final boolean _verdict;

  private final List<SmtProgram> _programs;

  public RecordingSolverBackend(boolean verdict) {
    _verdict = verdict;
    _programs = new ArrayList<>();
  }

  @Override
  public boolean isSatisfiable(SmtProgram program) {
    _programs.add(program);
    return _verdict;
  }

  public List<SmtProgram> getPrograms() {
    return _programs;
  }
}
