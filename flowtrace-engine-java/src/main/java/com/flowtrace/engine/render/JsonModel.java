package com.flowtrace.engine.render;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Map;

/**
 * POJOs of the JSON output. Field names use @SerializedName for snake_case; null fields are
 * left out of the document.
 */
public final class JsonModel {

    private JsonModel() {}

    public static class JsonResponse {
        @SerializedName("variable")         public String variable;
        @SerializedName("mode")             public String mode;
        @SerializedName("files")            public List<String> files;
        @SerializedName("results")          public List<JsonFlowResult> results;
        @SerializedName("impact")           public JsonImpact impact;
        @SerializedName("calculation_path") public List<JsonStep> calculationPath;
        @SerializedName("states")           public List<JsonState> states;
        @SerializedName("variables")        public List<JsonSummary> variables;
        @SerializedName("diagnostics")      public List<JsonDiagnostic> diagnostics;
        @SerializedName("error")            public JsonError error;
    }

    public static class JsonFlowResult {
        @SerializedName("variable")       public String variable;
        @SerializedName("direction")      public String direction;
        @SerializedName("affects")        public List<JsonEntry> affects;     // forward only
        @SerializedName("depends_on")     public List<JsonEntry> dependsOn;   // backward only
        @SerializedName("flow_paths")     public List<String> flowPaths;
        @SerializedName("total_count")    public int totalCount;
        @SerializedName("affected_lines") public List<Integer> affectedLines;
        @SerializedName("truncated")      public boolean truncated;
        @SerializedName("error")          public JsonError error;
    }

    public static class JsonEntry {
        @SerializedName("name")       public String name;
        @SerializedName("kind")       public String kind;
        @SerializedName("location")   public String location;
        @SerializedName("function")   public String function;
        @SerializedName("code")       public String code;
        @SerializedName("expression") public String expression;
        @SerializedName("depth")      public int depth;
    }

    public static class JsonImpact {
        @SerializedName("exit_points")       public List<JsonExitPoint> exitPoints;
        @SerializedName("counts")            public Map<String, Integer> counts;
        @SerializedName("functions_touched") public int functionsTouched;
        @SerializedName("risk")              public String risk;
        @SerializedName("recommendation")    public String recommendation;
        @SerializedName("heuristic")         public boolean heuristic;
        @SerializedName("note")              public String note;
    }

    public static class JsonExitPoint {
        @SerializedName("type")        public String type;
        @SerializedName("sub_type")    public String subType;
        @SerializedName("function")    public String function;
        @SerializedName("location")    public String location;
        @SerializedName("description") public String description;
    }

    public static class JsonStep {
        @SerializedName("name")       public String name;
        @SerializedName("kind")       public String kind;
        @SerializedName("location")   public String location;
        @SerializedName("code")       public String code;
        @SerializedName("expression") public String expression;
        @SerializedName("inputs")     public List<String> inputs;
    }

    public static class JsonState {
        @SerializedName("scope")      public String scope;
        @SerializedName("type_chain") public List<String> typeChain;
        @SerializedName("events")     public List<JsonEvent> events;
        @SerializedName("warnings")   public List<JsonWarning> warnings;
    }

    public static class JsonEvent {
        @SerializedName("event")      public String event;
        @SerializedName("type")       public String type;
        @SerializedName("nullable")   public boolean nullable;
        @SerializedName("location")   public String location;
        @SerializedName("expression") public String expression;
        @SerializedName("in_loop")        public boolean inLoop;
        @SerializedName("in_conditional") public boolean inConditional;
    }

    public static class JsonWarning {
        @SerializedName("kind")     public String kind;
        @SerializedName("message")  public String message;
        @SerializedName("location") public String location;
    }

    public static class JsonSummary {
        @SerializedName("name")        public String name;
        @SerializedName("definitions") public List<String> definitions;
        @SerializedName("depends_on")  public List<String> dependsOn;
        @SerializedName("dependents")  public List<String> dependents;
    }

    public static class JsonDiagnostic {
        @SerializedName("kind")     public String kind;
        @SerializedName("message")  public String message;
        @SerializedName("location") public String location;   // nullable
    }

    public static class JsonError {
        @SerializedName("kind")    public String kind;
        @SerializedName("message") public String message;
    }
}
