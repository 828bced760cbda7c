package org.sequent.base.util.prover.exceptions;

/**
 * Abstract class for exceptions raised by the prover itself (as opposed to a refutation, which is a normal result).
 */
public abstract class ProverException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  protected ProverException(String xiMessage)
  {
    super(xiMessage);
  }
}
