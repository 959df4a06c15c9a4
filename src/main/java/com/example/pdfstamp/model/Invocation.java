package com.example.pdfstamp.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 可复现本次盖章的命令行参数
 * 参数顺序固定，只包含非默认值
 */
public class Invocation {

    private final List<Argument> arguments;

    public Invocation(List<Argument> arguments) {
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public List<Argument> getArguments() {
        return arguments;
    }

    public boolean hasFlag(String flag) {
        return arguments.stream().anyMatch(a -> a.getFlag().equals(flag));
    }

    /**
     * 展开为命令行参数数组
     */
    public List<String> toArgs() {
        List<String> args = new ArrayList<>();
        for (Argument a : arguments) {
            args.add(a.getFlag());
            if (a.getValue() != null) {
                args.add(a.getValue());
            }
        }
        return args;
    }

    /**
     * 含空白字符的值用单引号括起
     */
    public String toCommandLine() {
        return toArgs().stream()
                .map(s -> s.chars().anyMatch(Character::isWhitespace) ? "'" + s + "'" : s)
                .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return toCommandLine();
    }

    public static class Argument {
        private final String flag;
        private final String value;

        public Argument(String flag, String value) {
            this.flag = flag;
            this.value = value;
        }

        public String getFlag() {
            return flag;
        }

        public String getValue() {
            return value;
        }
    }
}
