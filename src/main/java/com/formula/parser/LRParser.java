package com.formula.parser;

import com.formula.ast.ASTNode;
import com.formula.ast.NodeFactory;
import com.formula.exception.ResourceLimitException;
import com.formula.exception.SyntaxException;
import com.formula.grammar.Production;
import com.formula.lexer.Token;
import com.formula.lexer.TokenType;
import com.formula.lr.LRAction;
import com.formula.lr.ParsingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Table-driven shift-reduce parser.
 * <p>
 * The table is shared read-only; every call to {@link #parse(List)} works on its own
 * {@link ParserRuntimeContext}, so one parser instance can serve concurrent callers.
 */
public class LRParser {

    private static final Logger log = LoggerFactory.getLogger(LRParser.class);

    private final ParsingTable table;
    private final NodeFactory nodeFactory;
    private final ParserConfig config;

    public LRParser(ParsingTable table) {
        this(table, new NodeFactory(), ParserConfig.defaults());
    }

    public LRParser(ParsingTable table, NodeFactory nodeFactory, ParserConfig config) {
        this.table = table;
        this.nodeFactory = nodeFactory;
        this.config = config;
    }

    /**
     * Parse a token sequence ending with the end-of-input token.
     *
     * @param tokens Tokens from the lexer
     * @return the tree and parse statistics
     * @throws SyntaxException when no action applies and recovery is off or exhausted
     * @throws ResourceLimitException when the step or stack bound is exceeded
     */
    public ParseResult parse(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).isEndOfInput()) {
            throw new SyntaxException("Token sequence must end with the end-of-input token");
        }

        long start = System.nanoTime();
        ParserRuntimeContext context = new ParserRuntimeContext(tokens, config.maxStackDepth());
        context.pushStart(0);

        while (true) {
            int step = context.nextStep();
            if (step > config.maxSteps()) {
                throw new ResourceLimitException("parseSteps", config.maxSteps(), step);
            }

            int state = context.currentState();
            Token lookahead = context.lookahead();
            LRAction action = table.getAction(state, lookahead.type());

            if (action == null) {
                handleError(context, state, lookahead);
            } else if (action instanceof LRAction.Shift) {
                push(context, ((LRAction.Shift) action).state(), lookahead);
                context.countShift();
                context.advance();
            } else if (action instanceof LRAction.Reduce) {
                reduce(context, ((LRAction.Reduce) action).production());
            } else {
                ASTNode root = (ASTNode) context.topValue();
                nodeFactory.validateTree(root);
                long elapsed = System.nanoTime() - start;
                log.debug("Parsed {} tokens in {} steps ({} shifts, {} reduces)",
                        tokens.size(), context.steps(), context.shifts(), context.reduces());
                return new ParseResult(root, context.steps(), context.shifts(), context.reduces(),
                        context.warnings(), elapsed);
            }
        }
    }

    private void reduce(ParserRuntimeContext context, Production production) {
        List<Object> children = context.pop(production.length());
        ASTNode node = production.builder().build(children, nodeFactory);
        int below = context.currentState();
        int target = table.getGoto(below, production.left());
        if (target < 0) {
            throw new SyntaxException("No goto from state " + below + " on " + production.left().symbol());
        }
        push(context, target, node);
        context.countReduce();
    }

    private void push(ParserRuntimeContext context, int state, Object value) {
        if (!context.canPush()) {
            throw new ResourceLimitException("parseStackDepth", config.maxStackDepth(), context.depth());
        }
        context.push(state, value);
    }

    private void handleError(ParserRuntimeContext context, int state, Token lookahead) {
        if (config.errorRecovery()
                && !lookahead.isEndOfInput()
                && context.recoveries() < config.maxRecoveryAttempts()) {
            String warning = "Skipped unexpected '" + lookahead.text() + "' at position " + lookahead.position();
            log.warn("{} (state {})", warning, state);
            context.recover(warning);
            return;
        }
        throw new SyntaxException(expected(state), lookahead.text(), state, lookahead.position());
    }

    private Set<String> expected(int state) {
        Set<String> expected = new LinkedHashSet<>();
        for (TokenType type : table.expectedTerminals(state)) {
            expected.add(type.symbol());
        }
        return expected;
    }
}
