package com.flamingo.ai.smartretrieval.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the adaptive retrieval engine. */
@Configuration
@ConfigurationProperties(prefix = "retrieval")
@Getter
@Setter
public class RetrievalConfig {

  /** Global ceiling on the number of chunks handed to the prompt. */
  private int maxChunks = 35;

  private Probe probe = new Probe();
  private Focus focus = new Focus();
  private Vocabulary vocabulary = new Vocabulary();
  private Iterative iterative = new Iterative();
  private Index index = new Index();

  @Getter
  @Setter
  public static class Probe {
    /** Size of the broad first-stage search across all sources. */
    private int size = 10;

    /** Bucket for probe hits whose metadata carries no source. */
    private String defaultSource = "synced";
  }

  /**
   * Focus thresholds for the two-stage search. These values change retrieval behaviour; they are
   * candidates for offline evaluation, not for casual tuning.
   */
  @Getter
  @Setter
  public static class Focus {
    /** Classifier confidence above which its suggested sources are searched directly. */
    private double highConfidenceThreshold = 0.7;

    /** Top source must beat the second by this factor to be searched alone. */
    private double singleSourceRatio = 1.15;

    /** Minimum probe hits the top source needs before it can be searched alone. */
    private int singleSourceMinCount = 2;

    /** Top source must beat the third by this factor for the top two to be searched. */
    private double pairRatio = 1.2;
  }

  /** Keyword vocabularies for query classification. Empty lists fall back to the built-ins. */
  @Getter
  @Setter
  public static class Vocabulary {
    private List<String> bookTerms = new ArrayList<>();
    private List<String> documentTerms = new ArrayList<>();
  }

  @Getter
  @Setter
  public static class Iterative {
    private boolean enabled = true;

    /** Maximum characters of the partial response shown to the assessment agent. */
    private int maxResponseChars = 500;

    /** Chunk count used when the agent does not suggest one. */
    private int defaultSuggestedCount = 5;
  }

  /** Elasticsearch chunk index used by the default search collaborator. */
  @Getter
  @Setter
  public static class Index {
    private String name = "knowledge_chunks";
    private String contentField = "content";
    private String sourceField = "source";
    private String embeddingField = "embedding";
    private int numCandidatesMultiplier = 2;
  }
}
