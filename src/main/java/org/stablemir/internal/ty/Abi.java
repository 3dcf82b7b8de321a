package org.stablemir.internal.ty;

/**
 * Calling convention of a function signature. Only conventions that can unwind carry a
 * meaningful {@code unwind} flag; it is always {@code false} for the others.
 *
 * @param convention The calling convention.
 * @param unwind     Whether unwinding across the boundary is permitted.
 */
public record Abi(Convention convention, boolean unwind) {

    public static final Abi RUST = of(Convention.RUST);

    public Abi {
        if (unwind && !convention.takesUnwind()) {
            throw new IllegalArgumentException(convention + " has no unwind variant");
        }
    }

    public static Abi of(Convention convention) {
        return new Abi(convention, false);
    }

    public enum Convention {
        RUST(false),
        C(true),
        CDECL(true),
        STDCALL(true),
        FASTCALL(true),
        VECTORCALL(true),
        THISCALL(true),
        AAPCS(true),
        WIN64(true),
        SYSV64(true),
        PTX_KERNEL(false),
        MSP430_INTERRUPT(false),
        X86_INTERRUPT(false),
        AMDGPU_KERNEL(false),
        EFI_API(false),
        AVR_INTERRUPT(false),
        AVR_NON_BLOCKING_INTERRUPT(false),
        C_CMSE_NONSECURE_CALL(false),
        WASM(false),
        SYSTEM(true),
        RUST_INTRINSIC(false),
        RUST_CALL(false),
        PLATFORM_INTRINSIC(false),
        UNADJUSTED(false),
        RUST_COLD(false);

        private final boolean takesUnwind;

        Convention(boolean takesUnwind) {
            this.takesUnwind = takesUnwind;
        }

        public boolean takesUnwind() {
            return takesUnwind;
        }
    }
}
