package tberg.kopls.kernel;

import tberg.kopls.ConfigurationException;

public enum KernelType {

	LINEAR,
	POLYNOMIAL,
	GAUSSIAN;

	public static KernelType fromTag(String tag) {
		if (tag != null) {
			String t = tag.trim().toLowerCase();
			if (t.equals("l") || t.equals("linear")) return LINEAR;
			if (t.equals("p") || t.equals("poly") || t.equals("polynomial")) return POLYNOMIAL;
			if (t.equals("g") || t.equals("gauss") || t.equals("gaussian") || t.equals("rbf")) return GAUSSIAN;
		}
		throw new ConfigurationException("Unknown kernel type `"+tag+"`, expected one of linear, polynomial, gaussian");
	}

}
