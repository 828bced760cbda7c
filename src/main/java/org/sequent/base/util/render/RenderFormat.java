package org.sequent.base.util.render;

/**
 * The available output formats.
 */
public enum RenderFormat
{
  LATEX
  {
    @Override
    public ProofRenderer createRenderer()
    {
      return new LatexProofRenderer();
    }
  },

  TEXT
  {
    @Override
    public ProofRenderer createRenderer()
    {
      return new TextProofRenderer();
    }
  };

  public abstract ProofRenderer createRenderer();

  /**
   * @return the format with the given name, ignoring case.
   *
   * @throws IllegalArgumentException if there is no such format.
   */
  public static RenderFormat fromName(String xiName)
  {
    for (RenderFormat lFormat : values())
    {
      if (lFormat.name().equalsIgnoreCase(xiName.trim()))
      {
        return lFormat;
      }
    }
    throw new IllegalArgumentException("Unknown render format: " + xiName);
  }
}
