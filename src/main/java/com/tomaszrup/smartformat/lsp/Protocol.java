package com.tomaszrup.smartformat.lsp;

/**
 * Shared constants for custom client↔server formatting messages.
 */
public final class Protocol {

	private Protocol() {
	}

	public static final String REQUEST_FORMAT_ON_PASTE = "smartFormat/formatOnPaste";

	/** On-type trigger an LSP client sends when the user presses return. */
	public static final String RETURN_TRIGGER = "\n";
}
