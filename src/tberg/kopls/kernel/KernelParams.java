package tberg.kopls.kernel;

import java.util.Collections;
import java.util.Map;

import tberg.kopls.ConfigurationException;

/**
 * A kernel family with its parameters, validated when it is created.
 */
public final class KernelParams {

	public static final String ORDER = "order";
	public static final String SIGMA = "sigma";

	private final KernelType type;
	private final double order;
	private final double sigma;

	private KernelParams(KernelType type, double order, double sigma) {
		this.type = type;
		this.order = order;
		this.sigma = sigma;
	}

	public static KernelParams linear() {
		return new KernelParams(KernelType.LINEAR, Double.NaN, Double.NaN);
	}

	public static KernelParams polynomial(double order) {
		if (!(order > 0.0) || Double.isInfinite(order)) throw new ConfigurationException("Polynomial kernel order must be positive, got "+order);
		return new KernelParams(KernelType.POLYNOMIAL, order, Double.NaN);
	}

	public static KernelParams gaussian(double sigma) {
		if (!(sigma > 0.0) || Double.isInfinite(sigma)) throw new ConfigurationException("Gaussian kernel sigma must be positive, got "+sigma);
		return new KernelParams(KernelType.GAUSSIAN, Double.NaN, sigma);
	}

	public static KernelParams of(String tag, Map<String,Double> params) {
		return of(KernelType.fromTag(tag), params);
	}

	public static KernelParams of(KernelType type, Map<String,Double> params) {
		Map<String,Double> p = params == null ? Collections.<String,Double>emptyMap() : params;
		switch (type) {
			case LINEAR:
				return linear();
			case POLYNOMIAL:
				return polynomial(require(type, p, ORDER));
			case GAUSSIAN:
				return gaussian(require(type, p, SIGMA));
			default:
				throw new ConfigurationException("Unsupported kernel type "+type);
		}
	}

	private static double require(KernelType type, Map<String,Double> params, String key) {
		Double value = params.get(key);
		if (value == null) throw new ConfigurationException("Kernel type "+type+" needs parameter `"+key+"`");
		return value;
	}

	public KernelMatrixBuilder builder() {
		switch (type) {
			case LINEAR:
				return new LinearKernelMatrixBuilder();
			case POLYNOMIAL:
				return new PolynomialKernelMatrixBuilder(order, 1.0);
			case GAUSSIAN:
				return new RBFKernelMatrixBuilder(sigma * sigma);
			default:
				throw new ConfigurationException("Unsupported kernel type "+type);
		}
	}

	public KernelType getType() {
		return type;
	}

	public double getOrder() {
		return order;
	}

	public double getSigma() {
		return sigma;
	}

	public boolean equals(Object o) {
		if (!(o instanceof KernelParams)) return false;
		KernelParams other = (KernelParams) o;
		return type == other.type && Double.compare(order, other.order) == 0 && Double.compare(sigma, other.sigma) == 0;
	}

	public int hashCode() {
		return type.hashCode() * 31 + Double.hashCode(order) * 17 + Double.hashCode(sigma);
	}

	public String toString() {
		switch (type) {
			case POLYNOMIAL: return "polynomial(order="+order+")";
			case GAUSSIAN: return "gaussian(sigma="+sigma+")";
			default: return "linear";
		}
	}

}
