package org.stablemir.bridge.convert;

/**
 * The converter instance for every supported family. Converters are stateless, so these are
 * shared by all sessions.
 */
public final class StableConverters {

	public static final StatementConverter STATEMENTS = new StatementConverter();
	public static final RvalueConverter RVALUES = new RvalueConverter();
	public static final OperandConverter OPERANDS = new OperandConverter();
	public static final PlaceConverter PLACES = new PlaceConverter();
	public static final TerminatorConverter TERMINATORS = new TerminatorConverter();
	public static final UnwindActionConverter UNWIND_ACTIONS = new UnwindActionConverter();
	public static final AssertMessageConverter ASSERT_MESSAGES = new AssertMessageConverter();
	public static final InlineAsmOperandConverter INLINE_ASM_OPERANDS = new InlineAsmOperandConverter();
	public static final BorrowKindConverter BORROW_KINDS = new BorrowKindConverter();
	public static final NullOpConverter NULL_OPS = new NullOpConverter();
	public static final CastKindConverter CAST_KINDS = new CastKindConverter();
	public static final PointerCoercionConverter POINTER_COERCIONS = new PointerCoercionConverter();
	public static final TyConverter TYPES = new TyConverter();
	public static final GenericArgsConverter GENERIC_ARGS = new GenericArgsConverter();
	public static final FnSigConverter FN_SIGS = new FnSigConverter();
	public static final PolyFnSigConverter POLY_FN_SIGS = new PolyFnSigConverter();
	public static final BoundVariableKindConverter BOUND_VARIABLES = new BoundVariableKindConverter();

	private StableConverters() {
	}
}
