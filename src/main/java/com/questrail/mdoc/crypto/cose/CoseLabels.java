package com.questrail.mdoc.crypto.cose;

/**
 * Integer labels from the IANA COSE registries used by this stack.
 */
public final class CoseLabels
{
    private CoseLabels() {}

    // Header parameters
    public static final int HEADER_ALG = 1;
    public static final int HEADER_X5CHAIN = 33;

    // COSE_Key common parameters
    public static final int KEY_KTY = 1;

    // EC2 key parameters
    public static final int EC2_CRV = -1;
    public static final int EC2_X = -2;
    public static final int EC2_Y = -3;

    public static final int KTY_EC2 = 2;

    // Structure contexts
    public static final String CONTEXT_SIGNATURE1 = "Signature1";
    public static final String CONTEXT_MAC0 = "MAC0";
}
