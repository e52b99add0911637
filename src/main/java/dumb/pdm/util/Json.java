package dumb.pdm.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;

public class Json {

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public static JsonNode node(Object obj) {
        return the.valueToTree(obj);
    }

    public static JsonNode tree(String json) throws JsonProcessingException {
        return the.readTree(json);
    }

    public static JsonNode tree(InputStream in) throws IOException {
        return the.readTree(in);
    }

    public static ObjectNode node() {
        return the.createObjectNode();
    }
}
