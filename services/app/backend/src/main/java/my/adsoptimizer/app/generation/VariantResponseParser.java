package my.adsoptimizer.app.generation;

import com.networknt.schema.InputFormat;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import my.adsoptimizer.app.validation.CreativeVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the structured {@code {"variants":[{"headlines":[],"descriptions":[]}]}} answer requested
 * through {@link #responseSchema()} and checks it against the same JSON schema.
 */
public class VariantResponseParser {
	private static final Logger logger = LoggerFactory.getLogger(VariantResponseParser.class);
	public static final String SCHEMA_NAME = "rsa_variants_response";
	private static final String RESPONSE_SCHEMA_JSON = """
			{
			  "$schema": "https://json-schema.org/draft/2020-12/schema",
			  "type": "object",
			  "additionalProperties": false,
			  "required": ["variants"],
			  "properties": {
			    "variants": {
			      "type": "array",
			      "items": {
			        "type": "object",
			        "additionalProperties": false,
			        "required": ["headlines", "descriptions"],
			        "properties": {
			          "headlines": {"type": "array", "items": {"type": "string"}},
			          "descriptions": {"type": "array", "items": {"type": "string"}}
			        }
			      }
			    }
			  }
			}
			""";

	private final ObjectMapper objectMapper;
	private final JsonSchema schema;
	private final Map<String, Object> responseSchema;

	public VariantResponseParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		try {
			this.schema = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(RESPONSE_SCHEMA_JSON);
			this.responseSchema = objectMapper.readValue(RESPONSE_SCHEMA_JSON, new TypeReference<Map<String, Object>>() {});
		} catch (Exception ex) {
			logger.error("Failed to load variant response JSON schema", ex);
			throw new IllegalStateException("Failed to load variant response schema");
		}
	}

	/**
	 * Schema sent with the completion request as {@code response_format}.
	 */
	public Map<String, Object> responseSchema() {
		return responseSchema;
	}

	public List<CreativeVariant> parse(String text, int expectedVariants) {
		if (text == null || text.isBlank()) {
			throw new GenerationParseException("Model response is empty", expectedVariants, 0);
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(stripCodeFence(text));
		} catch (Exception ex) {
			logger.warn("Could not parse model response as JSON: {}", ex.getMessage());
			throw new GenerationParseException("Model response is not valid JSON", expectedVariants, 0);
		}
		Set<ValidationMessage> violations = schema.validate(root.toString(), InputFormat.JSON);
		if (!violations.isEmpty()) {
			String details = violations.stream()
					.map(ValidationMessage::getMessage)
					.sorted()
					.collect(Collectors.joining("; "));
			logger.warn("Model response did not match the variant schema: {}", details);
			throw new GenerationParseException("Model response did not match schema: " + details, expectedVariants, 0);
		}

		JsonNode variantsNode = root.get("variants");
		int parsed = variantsNode.size();
		if (parsed < expectedVariants) {
			throw new GenerationParseException("Expected " + expectedVariants + " variants but parsed " + parsed,
					expectedVariants, parsed);
		}
		if (parsed > expectedVariants) {
			logger.warn("Model returned {} variants, keeping the first {}", parsed, expectedVariants);
		}
		List<CreativeVariant> variants = new ArrayList<>(expectedVariants);
		for (int i = 0; i < expectedVariants; i++) {
			JsonNode variantNode = variantsNode.get(i);
			List<String> headlines = texts(variantNode.get("headlines"));
			List<String> descriptions = texts(variantNode.get("descriptions"));
			if (headlines.isEmpty() && descriptions.isEmpty()) {
				throw new GenerationParseException("Variant " + (i + 1) + " has no headlines or descriptions",
						expectedVariants, parsed);
			}
			variants.add(new CreativeVariant(headlines, descriptions));
		}
		return List.copyOf(variants);
	}

	private static List<String> texts(JsonNode array) {
		List<String> values = new ArrayList<>(array.size());
		for (JsonNode item : array) {
			values.add(item.asString());
		}
		return values;
	}

	// Some models still wrap JSON in ```json fences despite the instruction.
	private static String stripCodeFence(String text) {
		String trimmed = text.trim();
		if (!trimmed.startsWith("```")) {
			return trimmed;
		}
		int firstNewline = trimmed.indexOf('\n');
		int lastFence = trimmed.lastIndexOf("```");
		if (firstNewline < 0 || lastFence <= firstNewline) {
			return trimmed;
		}
		return trimmed.substring(firstNewline + 1, lastFence).trim();
	}
}
