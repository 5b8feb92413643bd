package org.elnamic.runtime.builtins;

import org.elnamic.api.ScriptIOException;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.UnitValue;

import java.io.IOException;

import static org.elnamic.runtime.builtins.BuiltinArguments.string;

final class FileBuiltins {

    private FileBuiltins() {
        // Utility class
    }

    static void registerAll(BuiltinRegistry registry) {
        registry.register("read_file", 1, (args, ctx, at) -> {
            String path = string(args, 0, "read_file", at);
            try {
                return new StringValue(ctx.services().fileSystem().readFile(path));
            } catch (IOException e) {
                throw new ScriptIOException("Cannot read '" + path + "': " + e.getMessage(), at, e);
            }
        });

        registry.register("write_file", 2, (args, ctx, at) -> {
            String path = string(args, 0, "write_file", at);
            String content = args.get(1).toDisplayString();
            try {
                ctx.services().fileSystem().writeFile(path, content);
                return UnitValue.INSTANCE;
            } catch (IOException e) {
                throw new ScriptIOException("Cannot write '" + path + "': " + e.getMessage(), at, e);
            }
        });
    }
}
