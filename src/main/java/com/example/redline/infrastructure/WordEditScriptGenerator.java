package com.example.redline.infrastructure;

import com.example.redline.application.EditScriptGenerator;
import com.example.redline.domain.EditOperation;
import com.example.redline.domain.EditScript;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Myers diff over word, whitespace and punctuation tokens. Joining the tokens gives back the input
 * exactly, so the projections of the script reproduce both texts.
 */
@Component
public class WordEditScriptGenerator implements EditScriptGenerator {
    private static final Pattern TOKEN = Pattern.compile("\\s+|[\\p{L}\\p{N}]+|[^\\s\\p{L}\\p{N}]");

    @Override
    public EditScript diff(String original, String amended) {
        String left = original == null ? "" : original;
        String right = amended == null ? "" : amended;
        if (left.equals(right)) {
            return EditScript.unchanged(left);
        }
        List<String> leftTokens = tokenize(left);
        List<String> rightTokens = tokenize(right);
        Patch<String> patch = DiffUtils.diff(leftTokens, rightTokens);

        EditScript.Builder builder = new EditScript.Builder();
        int position = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            int sourceStart = delta.getSource().getPosition();
            builder.add(EditOperation.UNCHANGED, join(leftTokens.subList(position, sourceStart)));
            builder.add(EditOperation.DELETED, join(delta.getSource().getLines()));
            builder.add(EditOperation.INSERTED, join(delta.getTarget().getLines()));
            position = sourceStart + delta.getSource().size();
        }
        builder.add(EditOperation.UNCHANGED, join(leftTokens.subList(position, leftTokens.size())));
        return builder.build();
    }

    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(text);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static String join(List<String> tokens) {
        return String.join("", tokens);
    }
}
