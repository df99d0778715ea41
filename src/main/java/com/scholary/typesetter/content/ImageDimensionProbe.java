package com.scholary.typesetter.content;

import com.scholary.typesetter.measure.ImageDimensions;
import java.util.Optional;

/** Resolves the natural size of an image. An empty result means the size is unknown. */
public interface ImageDimensionProbe {

  Optional<ImageDimensions> probe(String src);
}
