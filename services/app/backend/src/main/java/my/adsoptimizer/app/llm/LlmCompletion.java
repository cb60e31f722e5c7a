package my.adsoptimizer.app.llm;

public record LlmCompletion(String text, String model) {
}
