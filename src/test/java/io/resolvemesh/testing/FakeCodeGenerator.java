package io.resolvemesh.testing;

import io.resolvemesh.exception.CodeGenerationException;
import io.resolvemesh.execution.CodeGenerator;
import io.resolvemesh.execution.GeneratedCode;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class FakeCodeGenerator implements CodeGenerator {
    public static final String VALID_SCRIPT = """
            import json

            def resolve_oracle():
                return {"decision": "true", "reason": "fixture", "sources": []}

            if __name__ == "__main__":
                print(json.dumps(resolve_oracle()))
            """;

    private final List<String> prompts = new CopyOnWriteArrayList<>();
    private volatile String code;
    private volatile String failure;

    public FakeCodeGenerator() {
        this(VALID_SCRIPT);
    }

    public FakeCodeGenerator(String code) {
        this.code = code;
    }

    public void respondWith(String code) {
        this.code = code;
        this.failure = null;
    }

    public void failWith(String message) {
        this.failure = message;
    }

    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    @Override
    public GeneratedCode generate(String prompt) {
        prompts.add(prompt);
        if (failure != null) {
            throw new CodeGenerationException(failure);
        }
        return new GeneratedCode(code, "fake-model");
    }
}
