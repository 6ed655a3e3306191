package tberg.kopls.model;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import tberg.kopls.InputValidationException;
import tberg.kopls.cv.CrossValidationType;
import tberg.kopls.kernel.KernelParams;

/**
 * Settings of a consensus kernel-OPLS fit. Built with {@link #builder()}, or read
 * from {@code kopls.*} properties.
 */
public final class FitOptions {

	public static final String DEFAULTS_RESOURCE = "kopls.properties";

	private final int maxPcomp;
	private final int maxOcomp;
	private final ModelType modelType;
	private final CrossValidationType cvType;
	private final int nfold;
	private final int nMC;
	private final double cvFrac;
	private final KernelParams kernelParams;
	private final int numWorkers;
	private final int nperm;
	private final long seed;

	private FitOptions(Builder b) {
		this.maxPcomp = b.maxPcomp;
		this.maxOcomp = b.maxOcomp;
		this.modelType = b.modelType;
		this.cvType = b.cvType;
		this.nfold = b.nfold;
		this.nMC = b.nMC;
		this.cvFrac = b.cvFrac;
		this.kernelParams = b.kernelParams;
		this.numWorkers = b.numWorkers;
		this.nperm = b.nperm;
		this.seed = b.seed;
	}

	public static Builder builder() {
		return new Builder();
	}

	/** Options from the {@value #DEFAULTS_RESOURCE} classpath resource, or built-in defaults when it is absent. */
	public static FitOptions defaults() {
		Properties props = new Properties();
		InputStream in = FitOptions.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE);
		if (in != null) {
			try {
				try {
					props.load(in);
				} finally {
					in.close();
				}
			} catch (IOException e) {
				throw new IllegalStateException("Cannot read "+DEFAULTS_RESOURCE, e);
			}
		}
		return fromProperties(props);
	}

	/**
	 * Reads {@code kopls.maxPcomp}, {@code kopls.maxOcomp}, {@code kopls.modelType},
	 * {@code kopls.cvType}, {@code kopls.nfold}, {@code kopls.nMC},
	 * {@code kopls.cvFrac}, {@code kopls.kernel.type}, {@code kopls.kernel.order},
	 * {@code kopls.kernel.sigma}, {@code kopls.numWorkers}, {@code kopls.nperm} and
	 * {@code kopls.seed}. Missing keys keep their default.
	 */
	public static FitOptions fromProperties(Properties props) {
		Builder b = builder();
		if (props.containsKey("kopls.maxPcomp")) b.maxPcomp(intValue(props, "kopls.maxPcomp"));
		if (props.containsKey("kopls.maxOcomp")) b.maxOcomp(intValue(props, "kopls.maxOcomp"));
		if (props.containsKey("kopls.modelType")) b.modelType(ModelType.fromTag(props.getProperty("kopls.modelType")));
		if (props.containsKey("kopls.cvType")) b.cvType(CrossValidationType.fromTag(props.getProperty("kopls.cvType")));
		if (props.containsKey("kopls.nfold")) b.nfold(intValue(props, "kopls.nfold"));
		if (props.containsKey("kopls.nMC")) b.nMC(intValue(props, "kopls.nMC"));
		if (props.containsKey("kopls.cvFrac")) b.cvFrac(doubleValue(props, "kopls.cvFrac"));
		if (props.containsKey("kopls.kernel.type")) {
			Map<String,Double> params = new HashMap<String,Double>();
			if (props.containsKey("kopls.kernel.order")) params.put(KernelParams.ORDER, doubleValue(props, "kopls.kernel.order"));
			if (props.containsKey("kopls.kernel.sigma")) params.put(KernelParams.SIGMA, doubleValue(props, "kopls.kernel.sigma"));
			b.kernel(KernelParams.of(props.getProperty("kopls.kernel.type"), params));
		}
		if (props.containsKey("kopls.numWorkers")) b.numWorkers(intValue(props, "kopls.numWorkers"));
		if (props.containsKey("kopls.nperm")) b.nperm(intValue(props, "kopls.nperm"));
		if (props.containsKey("kopls.seed")) b.seed(Long.parseLong(props.getProperty("kopls.seed").trim()));
		return b.build();
	}

	private static int intValue(Properties props, String key) {
		try {
			return Integer.parseInt(props.getProperty(key).trim());
		} catch (NumberFormatException e) {
			throw new InputValidationException("Property "+key+" is not an integer: "+props.getProperty(key));
		}
	}

	private static double doubleValue(Properties props, String key) {
		try {
			return Double.parseDouble(props.getProperty(key).trim());
		} catch (NumberFormatException e) {
			throw new InputValidationException("Property "+key+" is not a number: "+props.getProperty(key));
		}
	}

	public int getMaxPcomp() {
		return maxPcomp;
	}

	public int getMaxOcomp() {
		return maxOcomp;
	}

	public ModelType getModelType() {
		return modelType;
	}

	public CrossValidationType getCvType() {
		return cvType;
	}

	public int getNfold() {
		return nfold;
	}

	public int getNMC() {
		return nMC;
	}

	public double getCvFrac() {
		return cvFrac;
	}

	public KernelParams getKernelParams() {
		return kernelParams;
	}

	public int getNumWorkers() {
		return numWorkers;
	}

	public int getNperm() {
		return nperm;
	}

	public long getSeed() {
		return seed;
	}

	/** Copy of these options with a different maxOcomp, worker count and permutation count. */
	public FitOptions with(int maxOcomp, int numWorkers, int nperm) {
		return toBuilder().maxOcomp(maxOcomp).numWorkers(numWorkers).nperm(nperm).build();
	}

	public Builder toBuilder() {
		return builder().maxPcomp(maxPcomp).maxOcomp(maxOcomp).modelType(modelType).cvType(cvType).nfold(nfold).nMC(nMC)
			.cvFrac(cvFrac).kernel(kernelParams).numWorkers(numWorkers).nperm(nperm).seed(seed);
	}

	public String toString() {
		return "FitOptions(maxPcomp="+maxPcomp+", maxOcomp="+maxOcomp+", modelType="+modelType.tag()+", cvType="+cvType.tag()
			+", nfold="+nfold+", nMC="+nMC+", cvFrac="+cvFrac+", kernel="+kernelParams+", numWorkers="+numWorkers+", nperm="+nperm+", seed="+seed+")";
	}

	public static final class Builder {

		private int maxPcomp = 1;
		private int maxOcomp = 5;
		private ModelType modelType = ModelType.DISCRIMINANT;
		private CrossValidationType cvType = CrossValidationType.NFOLD;
		private int nfold = 5;
		private int nMC = 100;
		private double cvFrac = 4.0/5.0;
		private KernelParams kernelParams = KernelParams.polynomial(1.0);
		private int numWorkers = 1;
		private int nperm = 0;
		private long seed = 0L;

		private Builder() {
		}

		public Builder maxPcomp(int maxPcomp) {
			this.maxPcomp = maxPcomp;
			return this;
		}

		public Builder maxOcomp(int maxOcomp) {
			this.maxOcomp = maxOcomp;
			return this;
		}

		public Builder modelType(ModelType modelType) {
			this.modelType = modelType;
			return this;
		}

		public Builder cvType(CrossValidationType cvType) {
			this.cvType = cvType;
			return this;
		}

		public Builder nfold(int nfold) {
			this.nfold = nfold;
			return this;
		}

		public Builder nMC(int nMC) {
			this.nMC = nMC;
			return this;
		}

		public Builder cvFrac(double cvFrac) {
			this.cvFrac = cvFrac;
			return this;
		}

		public Builder kernel(KernelParams kernelParams) {
			this.kernelParams = kernelParams;
			return this;
		}

		public Builder numWorkers(int numWorkers) {
			this.numWorkers = numWorkers;
			return this;
		}

		public Builder nperm(int nperm) {
			this.nperm = nperm;
			return this;
		}

		public Builder seed(long seed) {
			this.seed = seed;
			return this;
		}

		public FitOptions build() {
			if (maxPcomp < 1) throw new InputValidationException("maxPcomp must be at least 1, got "+maxPcomp);
			if (maxOcomp < 0) throw new InputValidationException("maxOcomp must be non-negative, got "+maxOcomp);
			if (modelType == null) throw new InputValidationException("modelType is required");
			if (cvType == null) throw new InputValidationException("cvType is required");
			if (kernelParams == null) throw new InputValidationException("kernel parameters are required");
			if (nfold < 2) throw new InputValidationException("nfold must be at least 2, got "+nfold);
			if (nMC < 1) throw new InputValidationException("nMC must be at least 1, got "+nMC);
			if (!(cvFrac > 0.0 && cvFrac < 1.0)) throw new InputValidationException("cvFrac must be in (0, 1), got "+cvFrac);
			if (numWorkers < 1) throw new InputValidationException("numWorkers must be at least 1, got "+numWorkers);
			if (nperm < 0) throw new InputValidationException("nperm must be non-negative, got "+nperm);
			return new FitOptions(this);
		}

	}

}
