package edu.jhu.hlt.ptb.transforms;

/**
 * A transform was asked to run on a tree without the shape it needs.
 */
public class StructuralPreconditionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public StructuralPreconditionException(String message) {
    super(message);
  }
}
