package org.stablemir.api.ty;

/**
 * Calling convention. {@code unwind} is only ever set for conventions that have an unwinding
 * variant.
 */
public record Abi(Convention convention, boolean unwind) {

    public enum Convention {
        RUST,
        C,
        CDECL,
        STDCALL,
        FASTCALL,
        VECTORCALL,
        THISCALL,
        AAPCS,
        WIN64,
        SYSV64,
        PTX_KERNEL,
        MSP430_INTERRUPT,
        X86_INTERRUPT,
        AMDGPU_KERNEL,
        EFI_API,
        AVR_INTERRUPT,
        AVR_NON_BLOCKING_INTERRUPT,
        C_CMSE_NONSECURE_CALL,
        WASM,
        SYSTEM,
        RUST_INTRINSIC,
        RUST_CALL,
        PLATFORM_INTRINSIC,
        UNADJUSTED,
        RUST_COLD
    }
}
