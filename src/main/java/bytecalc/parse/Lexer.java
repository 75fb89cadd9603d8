package bytecalc.parse;

import bytecalc.ast.SourceSpan;
import bytecalc.diag.DiagnosticException;
import bytecalc.diag.IntegerError;
import bytecalc.diag.LexError;
import bytecalc.parse.IntegerLiterals.IntegerFormatException;
import bytecalc.parse.IntegerLiterals.Radix;
import bytecalc.unit.FullUnit;
import bytecalc.unit.Unit;
import bytecalc.unit.UnitPrefix;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy lexer over the UTF-8 bytes of an expression.
 *
 * Tokens are produced on demand. The stream ends with exactly one {@link TokenKind#EOF} token,
 * after which {@link #hasNext()} is false. A lexical error is thrown from {@link #next()} as a
 * {@link DiagnosticException} carrying a {@link LexError} and also ends the stream.
 *
 * At each position, in order: punctuation, a bare {@code b}/{@code B}, the keyword {@code as},
 * an integer literal, then a prefixed unit such as {@code KiB} or {@code mb}.
 */
public final class Lexer implements Iterator<Token> {
	private final byte[] input;
	private int current;
	private boolean done;

	public Lexer(String source) {
		this.input = source.getBytes(StandardCharsets.UTF_8);
	}

	/** Lexes the whole source eagerly, EOF included. */
	public static List<Token> tokenize(String source) {
		List<Token> tokens = new ArrayList<>();
		new Lexer(source).forEachRemaining(tokens::add);
		return tokens;
	}

	@Override
	public boolean hasNext() {
		return !done;
	}

	@Override
	public Token next() {
		if (done) {
			throw new NoSuchElementException("lexer already produced EOF");
		}
		skipWhitespace();
		if (current >= input.length) {
			done = true;
			return Token.of(TokenKind.EOF, SourceSpan.of(current, 0));
		}
		try {
			Token token = lexToken();
			current = token.span().endOffset();
			return token;
		} catch (DiagnosticException e) {
			done = true;
			throw e;
		}
	}

	private Token lexToken() {
		byte c = input[current];
		switch (c) {
			case '-':
				return single(TokenKind.MINUS);
			case '+':
				return single(TokenKind.PLUS);
			case '*':
				return single(TokenKind.STAR);
			case '/':
				return single(TokenKind.SLASH);
			case '(':
				return single(TokenKind.LEFT_PAREN);
			case ')':
				return single(TokenKind.RIGHT_PAREN);
			case 'b':
				return Token.unit(FullUnit.BIT, span(1));
			case 'B':
				return Token.unit(FullUnit.BYTE, span(1));
			default:
				break;
		}
		if (c == 'a' && peek(1) == 's') {
			return Token.of(TokenKind.AS, span(2));
		}
		if (c >= '0' && c <= '9') {
			return integer();
		}
		UnitPrefix decimal = UnitPrefix.fromLetter((char) c, false);
		if (decimal != null) {
			return prefixedUnit(c);
		}
		throw unexpectedCharacter(current);
	}

	private Token integer() {
		Radix radix = input[current] == '0' ? Radix.fromPrefixLetter(peek(1)) : null;
		int digitsStart = radix == null ? current : current + 2;
		if (radix == null) {
			radix = Radix.DECIMAL;
		}
		boolean prefixed = digitsStart != current;
		try {
			IntegerLiterals.Scan scan = IntegerLiterals.scan(input, digitsStart, radix, prefixed);
			return Token.integer(scan.value(), new SourceSpan(current, scan.end()));
		} catch (IntegerFormatException e) {
			int offset = digitsStart;
			if (e.error() instanceof IntegerError.InvalidDigitAt invalid) {
				offset += invalid.index();
			}
			throw new DiagnosticException(LexError.invalidDigit(e.error(), offset), e);
		}
	}

	private Token prefixedUnit(byte letter) {
		boolean binary = peek(1) == 'i' || peek(1) == 'I';
		int prefixLength = binary ? 2 : 1;
		UnitPrefix prefix = UnitPrefix.fromLetter((char) letter, binary);
		int unitLetter = peek(prefixLength);
		Unit unit;
		if (unitLetter == 'b') {
			unit = Unit.BIT;
		} else if (unitLetter == 'B') {
			unit = Unit.BYTE;
		} else {
			// the prefix is only valid as the start of a unit
			throw unexpectedCharacter(current);
		}
		return Token.unit(FullUnit.of(prefix, unit), span(prefixLength + 1));
	}

	private Token single(TokenKind kind) {
		return Token.of(kind, span(1));
	}

	private SourceSpan span(int length) {
		return SourceSpan.of(current, length);
	}

	/** Byte {@code ahead} positions past the current one, or -1 past the end. */
	private int peek(int ahead) {
		int index = current + ahead;
		return index < input.length ? input[index] : -1;
	}

	private void skipWhitespace() {
		while (current < input.length && isAsciiWhitespace(input[current])) {
			current++;
		}
	}

	private static boolean isAsciiWhitespace(byte c) {
		return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
	}

	private static DiagnosticException unexpectedCharacter(int offset) {
		return new DiagnosticException(LexError.unexpectedCharacter(offset));
	}
}
