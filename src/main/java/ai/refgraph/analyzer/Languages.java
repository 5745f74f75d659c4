package ai.refgraph.analyzer;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.util.List;
import java.util.Locale;

public class Languages {
    public static final Language PYTHON = new Language() {
        private final List<String> extensions = List.of("py");
        private final Supplier<ISymbolParser> parser = Suppliers.memoize(PythonTreeSitterParser::new);

        @Override
        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String name() {
            return "Python";
        }

        @Override
        public String internalName() {
            return "PYTHON";
        }

        @Override
        public ISymbolParser getParser() {
            return parser.get();
        }

        @Override
        public ParserCapability capability() {
            return ParserCapability.EXACT_GRAMMAR;
        }

        @Override
        public String toString() {
            return name();
        }
    };

    public static final Language JAVASCRIPT = new Language() {
        private final List<String> extensions = List.of("js", "mjs", "cjs", "jsx");
        private final Supplier<ISymbolParser> parser =
                Suppliers.memoize(() -> new RegexSymbolParser(HeuristicSyntax.JAVASCRIPT));

        @Override
        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String name() {
            return "JavaScript";
        }

        @Override
        public String internalName() {
            return "JAVASCRIPT";
        }

        @Override
        public ISymbolParser getParser() {
            return parser.get();
        }

        @Override
        public String toString() {
            return name();
        }
    };

    public static final Language TYPESCRIPT = new Language() {
        private final List<String> extensions = List.of("ts", "tsx");
        private final Supplier<ISymbolParser> parser =
                Suppliers.memoize(() -> new RegexSymbolParser(HeuristicSyntax.TYPESCRIPT));

        @Override
        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String name() {
            return "TypeScript";
        }

        @Override
        public String internalName() {
            return "TYPESCRIPT";
        }

        @Override
        public ISymbolParser getParser() {
            return parser.get();
        }

        @Override
        public String toString() {
            return name();
        }
    };

    public static final Language JAVA = new Language() {
        private final List<String> extensions = List.of("java");
        private final Supplier<ISymbolParser> parser =
                Suppliers.memoize(() -> new RegexSymbolParser(HeuristicSyntax.JAVA));

        @Override
        public List<String> getExtensions() {
            return extensions;
        }

        @Override
        public String name() {
            return "Java";
        }

        @Override
        public String internalName() {
            return "JAVA";
        }

        @Override
        public ISymbolParser getParser() {
            return parser.get();
        }

        @Override
        public String toString() {
            return name();
        }
    };

    public static final Language NONE = new Language() {
        private final Supplier<ISymbolParser> parser =
                Suppliers.memoize(() -> new RegexSymbolParser(HeuristicSyntax.PLAIN));

        @Override
        public List<String> getExtensions() {
            return List.of();
        }

        @Override
        public String name() {
            return "None";
        }

        @Override
        public String internalName() {
            return "NONE";
        }

        @Override
        public ISymbolParser getParser() {
            return parser.get();
        }

        @Override
        public String toString() {
            return name();
        }
    };

    public static final List<Language> ALL_LANGUAGES = List.of(PYTHON, JAVASCRIPT, TYPESCRIPT, JAVA);

    public static Language fromExtension(String extension) {
        var lower = extension.toLowerCase(Locale.ROOT);
        for (var lang : ALL_LANGUAGES) {
            if (lang.getExtensions().contains(lower)) {
                return lang;
            }
        }
        return NONE;
    }

    public static boolean isSourceExtension(String extension) {
        return fromExtension(extension) != NONE;
    }
}
