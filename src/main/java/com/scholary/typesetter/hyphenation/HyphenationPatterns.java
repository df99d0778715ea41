package com.scholary.typesetter.hyphenation;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import org.apache.fop.hyphenation.HyphenationTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads compiled Liang hyphenation patterns, such as {@code hyph/en.hyp} shipped in the OFFO
 * pattern jar, from the classpath.
 */
public final class HyphenationPatterns {

  private static final Logger log = LoggerFactory.getLogger(HyphenationPatterns.class);

  private HyphenationPatterns() {}

  public static HyphenationTree load(String resource) {
    ClassLoader loader = HyphenationPatterns.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new HyphenationPatternsException(
            "Hyphenation patterns not on classpath: " + resource);
      }
      try (ObjectInputStream objects = new ObjectInputStream(new BufferedInputStream(in))) {
        HyphenationTree tree = (HyphenationTree) objects.readObject();
        log.info("Loaded hyphenation patterns {}", resource);
        return tree;
      }
    } catch (IOException | ClassNotFoundException | ClassCastException e) {
      throw new HyphenationPatternsException("Failed to read hyphenation patterns " + resource, e);
    }
  }
}
