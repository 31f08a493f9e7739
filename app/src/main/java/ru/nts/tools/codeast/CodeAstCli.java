/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.codeast;

import picocli.CommandLine;
import ru.nts.tools.codeast.ast.AstNode;
import ru.nts.tools.codeast.ast.SourceCodeAst;
import ru.nts.tools.codeast.config.ParseOptions;
import ru.nts.tools.codeast.config.SyntaxErrorPolicy;
import ru.nts.tools.codeast.core.CodeAstException;
import ru.nts.tools.codeast.core.InvalidOptionException;
import ru.nts.tools.codeast.json.ComponentJsonWriter;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Командная строка: разбирает файл и печатает его компоненты.
 *
 * <pre>
 * code-ast --lang python [--syntax-error warn] [--option key=value] [--json] [--tree] file.py
 * </pre>
 *
 * Коды выхода: 0 успех, 1 ошибка разбора или чтения файла, 2 неверные аргументы
 * (включая неизвестное значение {@code --syntax-error}).
 */
@CommandLine.Command(name = "code-ast", version = "code-ast 1.0.0", mixinStandardHelpOptions = true,
        description = "Parses a source file and prints its semantic components.")
public final class CodeAstCli implements Callable<Integer> {

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_ERROR = CommandLine.ExitCode.SOFTWARE;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    @CommandLine.Option(names = "--lang", paramLabel = "<lang>", defaultValue = CodeAst.GUESS,
            description = "Source language: python, java or javascript (aliases py, js, ...)")
    private String lang;

    @CommandLine.Option(names = "--syntax-error", paramLabel = "<policy>", converter = PolicyConverter.class,
            description = "Reaction to syntax errors: raise, warn or ignore (default: raise)")
    private SyntaxErrorPolicy syntaxErrorPolicy = SyntaxErrorPolicy.DEFAULT;

    @CommandLine.Option(names = "--option", paramLabel = "<key=value>",
            description = "Language option passed through to the parser config, may repeat")
    private Map<String, String> options = new LinkedHashMap<>();

    @CommandLine.Option(names = "--json", description = "Print JSON instead of plain text")
    private boolean json;

    @CommandLine.Option(names = "--tree", description = "Print the whole tree instead of components")
    private boolean tree;

    @CommandLine.Parameters(index = "0", paramLabel = "<file>", description = "Source file to parse")
    private Path file;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        // Компоненты содержат произвольный текст исходника, вывод всегда в UTF-8
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Выполняет команду с заданными потоками вывода. Текст пишется в UTF-8 независимо от кодировки потока.
     *
     * @return код выхода
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        PrintWriter outWriter = new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true);
        PrintWriter errWriter = new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true);
        try {
            return new CommandLine(new CodeAstCli())
                    .setOut(outWriter)
                    .setErr(errWriter)
                    .execute(args);
        } finally {
            outWriter.flush();
            errWriter.flush();
        }
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ParseOptions parseOptions = ParseOptions.of(syntaxErrorPolicy);
        for (Map.Entry<String, String> option : options.entrySet()) {
            parseOptions = parseOptions.withOption(option.getKey(), option.getValue());
        }

        try {
            SourceCodeAst ast = CodeAst.defaultInstance().parseFile(file, lang, parseOptions);
            print(ast, out);
            return EXIT_OK;
        } catch (CodeAstException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void print(SourceCodeAst ast, PrintWriter out) {
        if (json) {
            ComponentJsonWriter writer = new ComponentJsonWriter();
            out.println(writer.write(tree
                    ? writer.treeToJson(ast)
                    : writer.componentsToJson(ast.language(), ast.components())));
            return;
        }
        if (tree) {
            out.println(ast.toSExpression());
            return;
        }
        List<AstNode> components = ast.components();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) {
                out.println();
            }
            out.println(components.get(i).text());
        }
    }

    /**
     * {@code raise|warn|ignore} без учёта регистра; неизвестное значение считается ошибкой аргументов.
     */
    public static final class PolicyConverter implements CommandLine.ITypeConverter<SyntaxErrorPolicy> {
        @Override
        public SyntaxErrorPolicy convert(String value) {
            try {
                return SyntaxErrorPolicy.fromId(value);
            } catch (InvalidOptionException e) {
                throw new CommandLine.TypeConversionException(e.getCode().format(e.getContext()));
            }
        }
    }
}
