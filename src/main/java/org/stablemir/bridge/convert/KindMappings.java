package org.stablemir.bridge.convert;

import org.stablemir.api.mir.AsyncGeneratorKind;
import org.stablemir.api.mir.BinOp;
import org.stablemir.api.mir.GeneratorKind;
import org.stablemir.api.mir.MutBorrowKind;
import org.stablemir.api.mir.Mutability;
import org.stablemir.api.mir.Safety;
import org.stablemir.api.mir.UnOp;
import org.stablemir.api.ty.Abi;
import org.stablemir.api.ty.FloatTy;
import org.stablemir.api.ty.IntTy;
import org.stablemir.api.ty.Movability;
import org.stablemir.api.ty.UintTy;
import org.stablemir.internal.ty.Unsafety;

/**
 * One-to-one mappings of payload-free tags. Each is a switch expression over the compiler enum, so a
 * new compiler constant is a compile error here.
 */
public final class KindMappings {

	private KindMappings() {
	}

	public static Mutability mutability(org.stablemir.internal.ty.Mutability mutability) {
		return switch (mutability) {
			case NOT -> Mutability.NOT;
			case MUT -> Mutability.MUT;
		};
	}

	public static MutBorrowKind mutBorrowKind(org.stablemir.internal.mir.MutBorrowKind kind) {
		return switch (kind) {
			case DEFAULT -> MutBorrowKind.DEFAULT;
			case TWO_PHASE_BORROW -> MutBorrowKind.TWO_PHASE_BORROW;
			case CLOSURE_CAPTURE -> MutBorrowKind.CLOSURE_CAPTURE;
		};
	}

	public static Safety safety(Unsafety unsafety) {
		return switch (unsafety) {
			case UNSAFE -> Safety.UNSAFE;
			case NORMAL -> Safety.NORMAL;
		};
	}

	public static Movability movability(org.stablemir.internal.ty.Movability movability) {
		return switch (movability) {
			case STATIC -> Movability.STATIC;
			case MOVABLE -> Movability.MOVABLE;
		};
	}

	public static BinOp binOp(org.stablemir.internal.mir.BinOp op) {
		return switch (op) {
			case ADD -> BinOp.ADD;
			case ADD_UNCHECKED -> BinOp.ADD_UNCHECKED;
			case SUB -> BinOp.SUB;
			case SUB_UNCHECKED -> BinOp.SUB_UNCHECKED;
			case MUL -> BinOp.MUL;
			case MUL_UNCHECKED -> BinOp.MUL_UNCHECKED;
			case DIV -> BinOp.DIV;
			case REM -> BinOp.REM;
			case BIT_XOR -> BinOp.BIT_XOR;
			case BIT_AND -> BinOp.BIT_AND;
			case BIT_OR -> BinOp.BIT_OR;
			case SHL -> BinOp.SHL;
			case SHL_UNCHECKED -> BinOp.SHL_UNCHECKED;
			case SHR -> BinOp.SHR;
			case SHR_UNCHECKED -> BinOp.SHR_UNCHECKED;
			case EQ -> BinOp.EQ;
			case LT -> BinOp.LT;
			case LE -> BinOp.LE;
			case NE -> BinOp.NE;
			case GE -> BinOp.GE;
			case GT -> BinOp.GT;
			case OFFSET -> BinOp.OFFSET;
		};
	}

	public static UnOp unOp(org.stablemir.internal.mir.UnOp op) {
		return switch (op) {
			case NOT -> UnOp.NOT;
			case NEG -> UnOp.NEG;
		};
	}

	public static GeneratorKind generatorKind(org.stablemir.internal.mir.GeneratorKind kind) {
		return switch (kind) {
			case ASYNC_BLOCK -> new GeneratorKind.Async(AsyncGeneratorKind.BLOCK);
			case ASYNC_CLOSURE -> new GeneratorKind.Async(AsyncGeneratorKind.CLOSURE);
			case ASYNC_FN -> new GeneratorKind.Async(AsyncGeneratorKind.FN);
			case GEN -> new GeneratorKind.Gen();
		};
	}

	public static IntTy intTy(org.stablemir.internal.ty.IntTy intTy) {
		return switch (intTy) {
			case ISIZE -> IntTy.ISIZE;
			case I8 -> IntTy.I8;
			case I16 -> IntTy.I16;
			case I32 -> IntTy.I32;
			case I64 -> IntTy.I64;
			case I128 -> IntTy.I128;
		};
	}

	public static UintTy uintTy(org.stablemir.internal.ty.UintTy uintTy) {
		return switch (uintTy) {
			case USIZE -> UintTy.USIZE;
			case U8 -> UintTy.U8;
			case U16 -> UintTy.U16;
			case U32 -> UintTy.U32;
			case U64 -> UintTy.U64;
			case U128 -> UintTy.U128;
		};
	}

	public static FloatTy floatTy(org.stablemir.internal.ty.FloatTy floatTy) {
		return switch (floatTy) {
			case F32 -> FloatTy.F32;
			case F64 -> FloatTy.F64;
		};
	}

	/**
	 * Maps a calling convention through the fixed convention table, keeping the unwind flag.
	 */
	public static Abi abi(org.stablemir.internal.ty.Abi abi) {
		Abi.Convention convention = switch (abi.convention()) {
			case RUST -> Abi.Convention.RUST;
			case C -> Abi.Convention.C;
			case CDECL -> Abi.Convention.CDECL;
			case STDCALL -> Abi.Convention.STDCALL;
			case FASTCALL -> Abi.Convention.FASTCALL;
			case VECTORCALL -> Abi.Convention.VECTORCALL;
			case THISCALL -> Abi.Convention.THISCALL;
			case AAPCS -> Abi.Convention.AAPCS;
			case WIN64 -> Abi.Convention.WIN64;
			case SYSV64 -> Abi.Convention.SYSV64;
			case PTX_KERNEL -> Abi.Convention.PTX_KERNEL;
			case MSP430_INTERRUPT -> Abi.Convention.MSP430_INTERRUPT;
			case X86_INTERRUPT -> Abi.Convention.X86_INTERRUPT;
			case AMDGPU_KERNEL -> Abi.Convention.AMDGPU_KERNEL;
			case EFI_API -> Abi.Convention.EFI_API;
			case AVR_INTERRUPT -> Abi.Convention.AVR_INTERRUPT;
			case AVR_NON_BLOCKING_INTERRUPT -> Abi.Convention.AVR_NON_BLOCKING_INTERRUPT;
			case C_CMSE_NONSECURE_CALL -> Abi.Convention.C_CMSE_NONSECURE_CALL;
			case WASM -> Abi.Convention.WASM;
			case SYSTEM -> Abi.Convention.SYSTEM;
			case RUST_INTRINSIC -> Abi.Convention.RUST_INTRINSIC;
			case RUST_CALL -> Abi.Convention.RUST_CALL;
			case PLATFORM_INTRINSIC -> Abi.Convention.PLATFORM_INTRINSIC;
			case UNADJUSTED -> Abi.Convention.UNADJUSTED;
			case RUST_COLD -> Abi.Convention.RUST_COLD;
		};
		return new Abi(convention, abi.unwind());
	}
}
