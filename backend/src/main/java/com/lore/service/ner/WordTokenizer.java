package com.lore.service.ner;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按词边界切分文本
 *
 * 只输出词元（字母/数字/下划线），词内的连字符与撇号保留在同一个词中；标点与空白不产生词元。
 */
@Component
public class WordTokenizer {

    private static final Pattern WORD = Pattern.compile(
        "[\\p{L}\\p{N}_\\p{M}]+(?:[-'’][\\p{L}\\p{N}_\\p{M}]+)*");

    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = WORD.matcher(text);
        while (matcher.find()) {
            tokens.add(new Token(matcher.group(), matcher.start(), matcher.end()));
        }
        return tokens;
    }
}
