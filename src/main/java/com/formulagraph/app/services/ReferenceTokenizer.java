package com.formulagraph.app.services;

import com.formulagraph.app.exceptions.InvalidAddressException;
import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans formula text and extracts references, function names, operators and numeric literals.
 * This is a sequential pattern scan, not a grammar. Patterns run in priority order:
 * 1) qualified references  Sheet1!A1, 'Load Data'!A1:B4
 * 2) ranges                A1:B4
 * 3) single cells          A1, $B$2
 * 4) function heads        SUM(
 * 5) operators             + - * / ^ & % = <> < <= > >=
 * 6) numeric literals      12, 0.5, 1E-3
 * Every recognized span is blanked before the next pattern runs, so the cells of a
 * range are never counted again as lone cells. Tokenizing never fails.
 */
@Service
public class ReferenceTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceTokenizer.class);

    private static final String CELL = "\\$?[A-Z]{1,3}\\$?\\d+";
    private static final String SHEET = "('(?:[^']|'')+'|[A-Za-z_][A-Za-z0-9_.]*)";

    // Unrolled so long literals do not recurse in the regex engine
    private static final Pattern STRING_LITERAL = Pattern.compile("\"[^\"]*(?:\"\"[^\"]*)*\"?");
    private static final Pattern QUALIFIED = Pattern.compile(
            "(?<![\\w.'])" + SHEET + "!(" + CELL + ")(?::(" + CELL + "))?(?![\\w(])");
    private static final Pattern RANGE = Pattern.compile(
            "(?<![\\w.$])(" + CELL + "):(" + CELL + ")(?![\\w(])");
    private static final Pattern SINGLE_CELL = Pattern.compile(
            "(?<![\\w.$])(" + CELL + ")(?![\\w(!])");
    private static final Pattern FUNCTION_HEAD = Pattern.compile(
            "(?<![\\w.])([A-Za-z_][A-Za-z0-9_.]*)\\s*\\(");
    private static final Pattern OPERATOR = Pattern.compile(
            "<=|>=|<>|[*/^&%=<>]|(?<![0-9.][eE])[+-]");
    private static final Pattern NUMBER = Pattern.compile(
            "(?<![\\w.])(\\d+(?:\\.\\d+)?|\\.\\d+)(?:[eE][+-]?\\d+)?(?![\\w.])");

    /**
     * Tokenizes one formula. Text without the leading '=' is a literal and yields no tokens.
     */
    public FormulaTokens tokenize(String formula) {
        if (!Cell.isFormulaText(formula)) {
            return FormulaTokens.empty(formula);
        }
        char[] body = formula.substring(Cell.FORMULA_MARKER.length()).toCharArray();

        // Text inside "..." is data, never a reference
        blank(body, STRING_LITERAL);

        Set<CellReference> cells = new LinkedHashSet<>();
        Set<RangeReference> ranges = new LinkedHashSet<>();
        Set<String> functions = new LinkedHashSet<>();
        Set<Operator> operators = new LinkedHashSet<>();
        List<Double> constants = new ArrayList<>();

        Matcher qualified = QUALIFIED.matcher(new String(body));
        while (qualified.find()) {
            String sheet = QualifiedAddress.unquoteSheet(qualified.group(1));
            try {
                CellAddress first = CellAddress.parse(qualified.group(2));
                if (qualified.group(3) != null) {
                    ranges.add(new RangeReference(sheet, first, CellAddress.parse(qualified.group(3))));
                } else {
                    cells.add(new CellReference(sheet, first));
                }
            } catch (InvalidAddressException e) {
                logger.debug("Skipping unusable reference '{}' in {}", qualified.group(), formula);
            }
            blankSpan(body, qualified.start(), qualified.end());
        }

        Matcher range = RANGE.matcher(new String(body));
        while (range.find()) {
            try {
                ranges.add(new RangeReference(null,
                        CellAddress.parse(range.group(1)), CellAddress.parse(range.group(2))));
            } catch (InvalidAddressException e) {
                logger.debug("Skipping unusable range '{}' in {}", range.group(), formula);
            }
            blankSpan(body, range.start(), range.end());
        }

        Matcher cell = SINGLE_CELL.matcher(new String(body));
        while (cell.find()) {
            try {
                cells.add(new CellReference(null, CellAddress.parse(cell.group(1))));
            } catch (InvalidAddressException e) {
                logger.debug("Skipping unusable cell reference '{}' in {}", cell.group(), formula);
            }
            blankSpan(body, cell.start(), cell.end());
        }

        Matcher function = FUNCTION_HEAD.matcher(new String(body));
        while (function.find()) {
            functions.add(function.group(1).toUpperCase(Locale.ROOT));
            // Keep the parenthesis, only the name is consumed
            blankSpan(body, function.start(1), function.end(1));
        }

        Matcher operator = OPERATOR.matcher(new String(body));
        while (operator.find()) {
            Operator op = Operator.fromSymbol(operator.group());
            if (op != null) {
                operators.add(op);
            }
            blankSpan(body, operator.start(), operator.end());
        }

        Matcher number = NUMBER.matcher(new String(body));
        while (number.find()) {
            try {
                constants.add(Double.parseDouble(number.group()));
            } catch (NumberFormatException e) {
                logger.debug("Skipping unusable numeric literal '{}' in {}", number.group(), formula);
            }
        }

        return new FormulaTokens(formula, cells, ranges, functions, operators, constants);
    }

    private static void blank(char[] body, Pattern pattern) {
        Matcher matcher = pattern.matcher(new String(body));
        while (matcher.find()) {
            blankSpan(body, matcher.start(), matcher.end());
        }
    }

    private static void blankSpan(char[] body, int start, int end) {
        Arrays.fill(body, start, end, ' ');
    }
}
