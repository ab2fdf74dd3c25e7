package ai.policy.revision.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One operation record exactly as written in the JSON file. Both the generator's
 * {@code MatchCase} spelling and snake case are accepted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record PlanEntry(
        @JsonProperty("target_text") @JsonAlias("targetText") String targetText,
        @JsonProperty("action") String action,
        @JsonProperty("replacement") String replacement,
        @JsonProperty("comment") String comment,
        @JsonProperty("comment_author") @JsonAlias("commentAuthor") String commentAuthor,
        @JsonProperty("MatchCase") @JsonAlias({"match_case", "matchCase"}) Boolean matchCase,
        @JsonProperty("WholeWord") @JsonAlias({"whole_word", "wholeWord"}) Boolean wholeWord,
        @JsonProperty("Wildcards") @JsonAlias("wildcards") Boolean wildcards,
        @JsonProperty("whole_document") @JsonAlias("wholeDocument") Boolean wholeDocument,
        @JsonProperty("skip_if_absent") @JsonAlias("skipIfAbsent") Boolean skipIfAbsent,
        @JsonProperty("image_path") @JsonAlias("imagePath") String imagePath,
        @JsonProperty("width_mm") @JsonAlias("widthMm") Double widthMm,
        @JsonProperty("height_mm") @JsonAlias("heightMm") Double heightMm
) {
}
