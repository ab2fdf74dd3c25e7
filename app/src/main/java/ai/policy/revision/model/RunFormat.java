package ai.policy.revision.model;

/**
 * Character formatting of a run. The engine never looks inside it, it only copies it from the
 * first covered run onto inserted text.
 */
public interface RunFormat {

    RunFormat NONE = new RunFormat() {
        @Override
        public String toString() {
            return "RunFormat.NONE";
        }
    };
}
