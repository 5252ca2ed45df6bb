package exm.sdg.common;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Test;

public class LoggingTest {

  @Test
  public void testEmittedOnce() {
    String msg = "LoggingTest message " + System.nanoTime();
    assertTrue(Logging.addEmitted(Level.WARN, msg));
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    assertTrue(Logging.addEmitted(Level.INFO, msg));
    Logging.uniqueWarn(msg);
  }

  @Test
  public void testSetupFromSettings() throws Exception {
    Logger logger = Logging.setupLogging();
    assertSame(Logging.getSDGLogger(), logger);
    assertSame(Logger.getLogger("exm.sdg"), logger);
  }
}
