package com.decisionfacts.outcome;

import com.decisionfacts.taxonomy.MethodId;
import com.decisionfacts.taxonomy.Polarity;

/**
 * One matched snippet that supported a label.
 *
 * @param method       method that found the snippet
 * @param polarity     direction of the matched pattern
 * @param patternId    taxonomy id of the matched pattern
 * @param snippet      the lower-cased matched text
 * @param weight       weight of the matched pattern
 * @param contribution share of the method's weighted score for this polarity
 */
public record Evidence(
    MethodId method,
    Polarity polarity,
    String patternId,
    String snippet,
    double weight,
    double contribution
) {
}
