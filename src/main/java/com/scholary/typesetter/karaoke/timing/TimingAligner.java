package com.scholary.typesetter.karaoke.timing;

import com.scholary.typesetter.karaoke.WordNormalizer;
import com.scholary.typesetter.karaoke.WordTiming;
import java.util.ArrayList;
import java.util.List;

/**
 * Aligns transcript timings to the words of a block's text.
 *
 * <p>Every text word gets a timing. A text word takes the timing of the first of the next {@value
 * #LOOKAHEAD} transcript words that matches it; an unmatched word starts where the previous one
 * ended and lasts the average transcript word duration.
 */
public class TimingAligner {

  static final int LOOKAHEAD = 3;
  static final double DEFAULT_WORD_DURATION = 0.5;

  public List<WordTiming> align(String text, List<WordTiming> transcript) {
    List<WordTiming> aligned = new ArrayList<>();
    if (text == null || text.isBlank()) {
      return aligned;
    }
    double averageDuration = averageDuration(transcript);
    int transcriptIndex = 0;
    String[] words = text.strip().split("\\s+");

    for (int i = 0; i < words.length; i++) {
      String textWord = words[i];
      String normalized = WordNormalizer.normalizeWord(textWord);

      int matchIndex = -1;
      if (!normalized.isEmpty()) {
        int limit = Math.min(transcriptIndex + LOOKAHEAD, transcript.size());
        for (int j = transcriptIndex; j < limit; j++) {
          if (matches(normalized, WordNormalizer.normalizeWord(transcript.get(j).word()))) {
            matchIndex = j;
            break;
          }
        }
      }

      if (matchIndex >= 0) {
        WordTiming match = transcript.get(matchIndex);
        aligned.add(new WordTiming(textWord, match.start(), match.end()));
        transcriptIndex = matchIndex + 1;
      } else if (!aligned.isEmpty()) {
        double start = aligned.get(aligned.size() - 1).end();
        aligned.add(new WordTiming(textWord, start, start + averageDuration));
      } else if (!transcript.isEmpty()) {
        double start = transcript.get(0).start();
        aligned.add(new WordTiming(textWord, start, start + DEFAULT_WORD_DURATION));
      } else {
        double start = i * DEFAULT_WORD_DURATION;
        aligned.add(new WordTiming(textWord, start, start + DEFAULT_WORD_DURATION));
      }
    }
    return aligned;
  }

  private static boolean matches(String textWord, String transcriptWord) {
    if (transcriptWord.isEmpty()) {
      return false;
    }
    return transcriptWord.equals(textWord)
        || transcriptWord.contains(textWord)
        || textWord.contains(transcriptWord);
  }

  private static double averageDuration(List<WordTiming> transcript) {
    if (transcript.isEmpty()) {
      return DEFAULT_WORD_DURATION;
    }
    double total = 0;
    for (WordTiming timing : transcript) {
      total += timing.end() - timing.start();
    }
    return total / transcript.size();
  }
}
