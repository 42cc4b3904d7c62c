package org.mcts.base.search.exceptions;

/**
 * Exception thrown for an invalid search configuration.
 */
public class ConfigurationException extends IllegalArgumentException
{
  private static final long serialVersionUID = 1L;

  /**
   * @param xiMessage - what's wrong with the configuration.
   */
  public ConfigurationException(String xiMessage)
  {
    super(xiMessage);
  }

  /**
   * @param xiMessage - what's wrong with the configuration.
   * @param xiCause - the underlying failure.
   */
  public ConfigurationException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
