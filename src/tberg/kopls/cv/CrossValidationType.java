package tberg.kopls.cv;

import tberg.kopls.InputValidationException;

public enum CrossValidationType {

	/** k disjoint test groups, sample i tested in round i mod k */
	NFOLD("nfold"),
	/** Monte Carlo: independent random splits */
	MCCV("mccv"),
	/** Monte Carlo, class balanced: each class is split on its own */
	MCCVB("mccvb");

	private final String tag;

	private CrossValidationType(String tag) {
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}

	public static CrossValidationType fromTag(String tag) {
		if (tag != null) {
			for (CrossValidationType t : values()) {
				if (t.tag.equals(tag.trim().toLowerCase())) return t;
			}
		}
		throw new InputValidationException("cvType must be `nfold`, `mccv` or `mccvb`, got `"+tag+"`");
	}

}
