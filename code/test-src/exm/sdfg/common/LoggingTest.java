package exm.sdfg.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class LoggingTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @Test
  public void testFileLogging() throws Exception {
    File log = new File(tmp.getRoot(), "sdfg.log");
    Logger logger = Logging.setupLogging(log.getPath(), false);
    Level oldLevel = logger.getLevel();
    try {
      assertSame(Logging.getSDFGLogger(), logger);
      assertEquals(Level.DEBUG, logger.getLevel());
      logger.debug("nesting prog");
      logger.trace("not written");
      String text = FileUtils.readFileToString(log, StandardCharsets.UTF_8);
      assertTrue(text, text.contains("DEBUG sdfg nesting prog"));
      assertFalse(text.contains("not written"));
    } finally {
      for (Object a: Collections.list(logger.getAllAppenders())) {
        ((Appender)a).close();
      }
      logger.removeAllAppenders();
      logger.setLevel(oldLevel);
    }
  }

  @Test
  public void testNoLogFile() {
    Logger logger = Logging.getSDFGLogger();
    Level before = logger.getLevel();
    Logging.setupLogging("", true);
    assertEquals("Configuration left alone", before, logger.getLevel());
  }

  @Test
  public void testUniqueWarn() {
    String msg = "warned once " + System.nanoTime();
    Logging.uniqueWarn(msg);
    assertFalse(Logging.addEmitted(Level.WARN, msg));
    assertTrue(Logging.addEmitted(Level.INFO, msg));
  }
}
