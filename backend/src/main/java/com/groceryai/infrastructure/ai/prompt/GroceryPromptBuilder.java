package com.groceryai.infrastructure.ai.prompt;

import com.groceryai.domain.invocation.model.RetrievedDocument;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GroceryPromptBuilder {

    static final int MAX_CONTEXT_DOCUMENTS = 5;
    static final int MAX_DOCUMENT_CHARS = 500;

    static final String CONTEXT_HEADER = "Relevant Context from Product Catalog:";

    // ===== Extraction system prompt =====

    private static final String EXTRACTION_SYSTEM_PROMPT = """
            You are a specialized grocery list processing assistant. Your task is to accurately extract and structure grocery items from natural language text.

            Your capabilities:
            - Parse grocery lists in various formats (bullet points, numbered lists, free text, voice transcriptions)
            - Recognize produce, meat, dairy, pantry items and household products
            - Infer quantities and units from context when not explicitly stated
            - Identify item specifications (brand preferences, sizes, organic/non-organic)
            - Provide a confidence score for each extraction based on how clear the input is

            Constraints:
            - Only extract actual grocery/shopping items and ignore non-shopping content
            - Do not make up items that are not mentioned in the text
            - Do not provide medical, financial, or legal advice
            - Do not process requests unrelated to grocery shopping
            - Always provide valid JSON output

            Output Format:
            You must return a valid JSON object with the following structure:
            {
              "items": [
                {
                  "name": "item name (normalized to standard product name)",
                  "quantity": numeric value (default to 1 if not specified),
                  "unit": "unit of measurement (pieces, kg, lb, oz, liters, etc.)",
                  "specifications": ["list", "of", "specifications"],
                  "confidence": 0.0-1.0 (how confident you are in this extraction),
                  "original_text": "the exact text segment this was extracted from"
                }
              ],
              "unrecognized_text": ["any text segments that couldn't be identified as grocery items"],
              "parsing_notes": "any relevant notes about the extraction process"
            }""";

    private record Example(String input, String output) {}

    private static final List<Example> EXTRACTION_EXAMPLES = List.of(
            new Example("I need milk, 2 dozen eggs, and some bread", """
                    {
                      "items": [
                        {"name": "milk", "quantity": 1, "unit": "gallon", "specifications": [], "confidence": 0.85, "original_text": "milk"},
                        {"name": "eggs", "quantity": 24, "unit": "pieces", "specifications": ["large"], "confidence": 0.95, "original_text": "2 dozen eggs"},
                        {"name": "bread", "quantity": 1, "unit": "loaf", "specifications": [], "confidence": 0.9, "original_text": "some bread"}
                      ],
                      "unrecognized_text": [],
                      "parsing_notes": "Quantity for milk defaulted to 1 gallon. 'Some bread' interpreted as 1 loaf."
                    }"""),
            new Example("Get me 500g of chicken breast, organic if possible, also 1kg rice and tomatoes", """
                    {
                      "items": [
                        {"name": "chicken breast", "quantity": 500, "unit": "g", "specifications": ["organic preferred"], "confidence": 0.95, "original_text": "500g of chicken breast, organic if possible"},
                        {"name": "rice", "quantity": 1, "unit": "kg", "specifications": [], "confidence": 0.98, "original_text": "1kg rice"},
                        {"name": "tomatoes", "quantity": 1, "unit": "kg", "specifications": [], "confidence": 0.8, "original_text": "tomatoes"}
                      ],
                      "unrecognized_text": [],
                      "parsing_notes": "Tomatoes quantity not specified, defaulted to 1kg."
                    }"""),
            new Example("Apples (red ones please) x5, butter 250g, and don't forget the coffee beans", """
                    {
                      "items": [
                        {"name": "apples", "quantity": 5, "unit": "pieces", "specifications": ["red variety"], "confidence": 0.95, "original_text": "Apples (red ones please) x5"},
                        {"name": "butter", "quantity": 250, "unit": "g", "specifications": [], "confidence": 0.98, "original_text": "butter 250g"},
                        {"name": "coffee beans", "quantity": 1, "unit": "bag", "specifications": [], "confidence": 0.85, "original_text": "coffee beans"}
                      ],
                      "unrecognized_text": ["don't forget the"],
                      "parsing_notes": "Coffee beans quantity defaulted to 1 bag."
                    }""")
    );

    private static final String EXTRACTION_USER_TEMPLATE = """
            Please extract grocery items from the following text and return structured JSON.

            Input text:
            %s

            Remember to:
            1. Normalize item names to standard product names
            2. Include confidence scores for each item
            3. Handle quantities and units appropriately
            4. Note any ambiguous items or specifications
            5. Return ONLY valid JSON, no additional text""";

    public String buildExtractionSystemPrompt(boolean includeExamples) {
        if (!includeExamples) {
            return EXTRACTION_SYSTEM_PROMPT;
        }
        StringBuilder sb = new StringBuilder(EXTRACTION_SYSTEM_PROMPT);
        sb.append("\n\nExamples:\n");
        for (int i = 0; i < EXTRACTION_EXAMPLES.size(); i++) {
            Example example = EXTRACTION_EXAMPLES.get(i);
            sb.append("\nExample ").append(i + 1).append(":\n")
                    .append("Input: ").append(example.input()).append('\n')
                    .append("Output: ").append(example.output()).append('\n');
        }
        return sb.toString();
    }

    public String buildExtractionUserMessage(String groceryText) {
        return EXTRACTION_USER_TEMPLATE.formatted(groceryText);
    }

    /**
     * Prepends retrieved reference documents to a prompt. At most {@value #MAX_CONTEXT_DOCUMENTS}
     * documents are used, each cut to {@value #MAX_DOCUMENT_CHARS} characters.
     */
    public String withContext(String prompt, List<RetrievedDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return prompt;
        }
        StringBuilder sb = new StringBuilder("\n\n").append(CONTEXT_HEADER).append('\n');
        List<RetrievedDocument> used = documents.subList(0, Math.min(documents.size(), MAX_CONTEXT_DOCUMENTS));
        for (int i = 0; i < used.size(); i++) {
            RetrievedDocument doc = used.get(i);
            sb.append("\n--- Document ").append(i + 1).append(" ---\n");
            if (!doc.metadata().isEmpty()) {
                sb.append("Source: ").append(doc.source()).append('\n');
            }
            String content = doc.content();
            sb.append(content.length() > MAX_DOCUMENT_CHARS ? content.substring(0, MAX_DOCUMENT_CHARS) : content)
                    .append('\n');
        }
        return sb.append("\n\n").append(prompt).toString();
    }
}
